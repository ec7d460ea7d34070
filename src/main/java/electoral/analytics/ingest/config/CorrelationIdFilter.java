package electoral.analytics.ingest.config;

import electoral.analytics.ingest.util.CorrelationIdUtil;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Servlet filter that generates or extracts a correlation ID per request and keeps it
 * in the SLF4J MDC for the lifetime of the request.
 */
@Component
@Order(1)
public class CorrelationIdFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        try {
            String correlationId = getOrGenerateCorrelationId(httpRequest);
            CorrelationIdUtil.setCorrelationId(correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

            logger.debug("Request started: {} {}", httpRequest.getMethod(), httpRequest.getRequestURI());

            long startTime = System.currentTimeMillis();
            chain.doFilter(request, response);
            long duration = System.currentTimeMillis() - startTime;

            logger.info("Request completed: {} {} | Status: {} | Duration: {}ms",
                       httpRequest.getMethod(),
                       httpRequest.getRequestURI(),
                       httpResponse.getStatus(),
                       duration);

        } catch (Exception e) {
            logger.error("Request failed with exception", e);
            throw e;

        } finally {
            // request threads are pooled
            CorrelationIdUtil.clearCorrelationId();
        }
    }

    private String getOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId == null || correlationId.trim().isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }

        return correlationId;
    }
}
