package net.kairos.adapter.http;

import java.net.URI;

/** 대상 이름 → base URL. 템플릿의 {name} 을 치환한다 (예: http://agent-{name}:8000) */
public final class TargetEndpointResolver {
    public static final String DEFAULT_TEMPLATE = "http://agent-{name}:8000";

    private final String template;

    public TargetEndpointResolver(String template) {
        if (template == null || !template.contains("{name}")) {
            throw new IllegalArgumentException("Target URL template must contain {name}: " + template);
        }
        this.template = template.endsWith("/") ? template.substring(0, template.length() - 1) : template;
    }

    public URI resolve(String target, String path) {
        return URI.create(template.replace("{name}", target) + path);
    }
}
