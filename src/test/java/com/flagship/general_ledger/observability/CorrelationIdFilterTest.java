package com.flagship.general_ledger.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("An incoming correlation id is kept in MDC and echoed back")
    void testIncomingIdPropagated() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/tenants/acme/journal-entries");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenInChain.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, "acme");
            }
        });

        assertEquals("req-42", seenInChain.get());
        assertEquals("req-42", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
    }

    @Test
    @DisplayName("A missing header gets a generated id")
    void testIdGenerated() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/tenants/acme/accounts");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    @DisplayName("Actuator probes are not filtered")
    void testActuatorSkipped() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
