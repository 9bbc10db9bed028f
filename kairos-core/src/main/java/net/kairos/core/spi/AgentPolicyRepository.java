package net.kairos.core.spi;

public interface AgentPolicyRepository {
    /** 에이전트 자율 실행 스위치. 소유 정보가 없으면 false */
    boolean isAutonomyEnabled(String agentName) throws Exception;
}
