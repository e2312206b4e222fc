package dev.pekelund.medinterp.reportservice;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.medinterp.pipeline.PipelineMdc;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void reusesCallerRequestIdForLogsAndResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/reports/interpret");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse res) {
                seen.set(MDC.get(PipelineMdc.KEY_REQUEST_ID));
            }
        }));

        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get(PipelineMdc.KEY_REQUEST_ID)).isNull();
    }

    @Test
    void restoresOuterContextAfterTheRequest() throws Exception {
        MDC.put(PipelineMdc.KEY_REPORT_ID, "report_outer");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports/types");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(MDC.get(PipelineMdc.KEY_REPORT_ID)).isEqualTo("report_outer");
        assertThat(MDC.get(PipelineMdc.KEY_REQUEST_ID)).isNull();
    }

    @Test
    void replacesUnsafeOrOversizedIds() {
        assertThat(RequestIdFilter.resolveRequestId(" trace-1 ")).isEqualTo("trace-1");
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId("evil\nINFO forged line"))).isNotNull();
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId("x".repeat(129)))).isNotNull();
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId(null))).isNotNull();
    }
}
