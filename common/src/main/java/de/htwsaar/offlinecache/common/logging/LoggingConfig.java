package de.htwsaar.offlinecache.common.logging;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Konfiguration für Logging und Tracing.
 *
 * <p>Der {@link TraceIdFilter} läuft vor allen anderen Filtern, damit bereits die ersten
 * Logzeilen einer abgefangenen Anfrage die Trace-ID tragen.</p>
 */
@Configuration
public class LoggingConfig {

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration() {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>(new TraceIdFilter());
        registration.setName("traceIdFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
