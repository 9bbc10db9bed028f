package net.kairos.core.spi;

import net.kairos.core.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** 외부 플랫폼이 소유한 스케줄 정의. 코어는 실행 시각 기록 외에는 읽기만 한다. */
public interface ScheduleRepository {
    Optional<Schedule> findById(String id) throws Exception;
    List<Schedule> listEnabled() throws Exception;
    List<Schedule> listAll() throws Exception;

    /** null 인자는 기존 값 유지. UPDATED_AT은 건드리지 않는다(변경 감지 컬럼) */
    boolean updateRunTimes(String id, Instant lastRunAt, Instant nextRunAt) throws Exception;
}
