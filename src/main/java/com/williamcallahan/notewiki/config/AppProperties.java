package com.williamcallahan.notewiki.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed view of the {@code app.*} properties.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private RenderSettings render = new RenderSettings();
    private PageSettings page = new PageSettings();

    /**
     * Validates every settings group; runs once the properties are bound.
     */
    @PostConstruct
    public void validateConfiguration() {
        render.validateConfiguration();
        page.validateConfiguration();
    }

    public RenderSettings getRender() {
        return render;
    }

    public void setRender(RenderSettings render) {
        this.render = render;
    }

    public PageSettings getPage() {
        return page;
    }

    public void setPage(PageSettings page) {
        this.page = page;
    }
}
