package com.koni.homeenergy.infrastructure.web.admission;

import com.koni.homeenergy.infrastructure.resilience.AdmissionController;
import com.koni.homeenergy.infrastructure.resilience.AdmissionTier;
import com.koni.homeenergy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@UnitTest
@ExtendWith(MockitoExtension.class)
class AdmissionInterceptorTest {

    @Mock
    private AdmissionController admissionController;

    private AdmissionInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new AdmissionInterceptor(admissionController, "X-Client-Id");
    }

    @Test
    void shouldAdmitAnnotatedHandlerUnderItsTier() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Client-Id", "hub-42");

        boolean proceed = interceptor.preHandle(request, new MockHttpServletResponse(), handler("limited"));

        assertThat(proceed).isTrue();
        verify(admissionController).admit(AdmissionTier.LONG, "hub-42");
    }

    @Test
    void shouldSkipHandlersWithoutAdmission() throws Exception {
        boolean proceed = interceptor.preHandle(
                new MockHttpServletRequest(), new MockHttpServletResponse(), handler("unlimited"));

        assertThat(proceed).isTrue();
        verifyNoInteractions(admissionController);
    }

    @Test
    void shouldFallBackToForwardedForThenRemoteAddress() {
        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        MockHttpServletRequest direct = new MockHttpServletRequest();
        direct.setRemoteAddr("192.0.2.10");

        assertThat(interceptor.clientKey(forwarded)).isEqualTo("203.0.113.7");
        assertThat(interceptor.clientKey(direct)).isEqualTo("192.0.2.10");
    }

    private static HandlerMethod handler(String method) throws NoSuchMethodException {
        return new HandlerMethod(new SampleEndpoints(), SampleEndpoints.class.getMethod(method));
    }

    static class SampleEndpoints {

        @Admission(AdmissionTier.LONG)
        public void limited() {
        }

        public void unlimited() {
        }
    }
}
