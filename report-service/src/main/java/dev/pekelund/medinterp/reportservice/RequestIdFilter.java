package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.pipeline.PipelineMdc;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every report request with an id that ends up in the response header and, through
 * {@link PipelineMdc}, next to the report id and stage of the pipeline run it triggers. Caller
 * supplied ids are only reused when they are short tokens safe to write into log lines.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Pattern ACCEPTED_REQUEST_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
        FilterChain filterChain) throws ServletException, IOException {

        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try (PipelineMdc.Context ignored = PipelineMdc.forRequest(requestId)) {
            filterChain.doFilter(request, response);
        }
    }

    static String resolveRequestId(String candidate) {
        if (StringUtils.hasText(candidate) && ACCEPTED_REQUEST_ID.matcher(candidate.trim()).matches()) {
            return candidate.trim();
        }
        return UUID.randomUUID().toString();
    }
}
