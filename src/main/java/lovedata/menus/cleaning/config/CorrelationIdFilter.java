package lovedata.menus.cleaning.config;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lovedata.menus.cleaning.util.CorrelationIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a correlation id into MDC for every request. Cleaning runs store it
 * in {@code cleaning_runs.correlation_id}, and pipeline workers inherit it
 * through {@link CorrelationIdUtil#wrap(java.util.function.Supplier)}.
 *
 * A client-supplied X-Correlation-ID is kept when it fits the column;
 * otherwise a new UUID is used. The id is echoed in the response header.
 */
@Component
@Order(1)
public class CorrelationIdFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final int MAX_CORRELATION_ID_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String correlationId = resolveCorrelationId(httpRequest.getHeader(CORRELATION_ID_HEADER));
        CorrelationIdUtil.setCorrelationId(correlationId);
        httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

        boolean apiCall = httpRequest.getRequestURI().startsWith("/api/");
        long startTime = System.currentTimeMillis();
        try {
            if (apiCall) {
                logger.info("{} {} started ({} bytes)", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpRequest.getContentLengthLong());
            }
            chain.doFilter(request, response);
            if (apiCall) {
                logger.info("{} {} finished with {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), System.currentTimeMillis() - startTime);
            }
        } catch (IOException | ServletException | RuntimeException e) {
            logger.error("{} {} failed after {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    System.currentTimeMillis() - startTime, e);
            throw e;
        } finally {
            CorrelationIdUtil.clearCorrelationId();
        }
    }

    static String resolveCorrelationId(String header) {
        if (header != null) {
            String trimmed = header.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_CORRELATION_ID_LENGTH) {
                return trimmed;
            }
            logger.debug("Ignoring unusable correlation ID header of length {}", trimmed.length());
        }
        return UUID.randomUUID().toString();
    }
}
