package com.koni.homeenergy.infrastructure.web.admission;

import com.koni.homeenergy.infrastructure.resilience.AdmissionController;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies admission control to handlers annotated with {@link Admission}.
 *
 * The client is identified by the configured header, then the first
 * {@code X-Forwarded-For} hop, then the remote address. A rejection surfaces as
 * {@link com.koni.homeenergy.domain.exception.RateLimitedException} and is rendered
 * by the exception handler.
 */
@Slf4j
@Component
public class AdmissionInterceptor implements HandlerInterceptor {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final AdmissionController admissionController;
    private final String clientHeader;

    public AdmissionInterceptor(
            AdmissionController admissionController,
            @Value("${telemetry.admission.client-header:X-Client-Id}") String clientHeader) {
        this.admissionController = admissionController;
        this.clientHeader = clientHeader;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        Admission admission = handlerMethod.getMethodAnnotation(Admission.class);
        if (admission == null) {
            return true;
        }
        admissionController.admit(admission.value(), clientKey(request));
        return true;
    }

    String clientKey(HttpServletRequest request) {
        String client = request.getHeader(clientHeader);
        if (StringUtils.hasText(client)) {
            return client.trim();
        }
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
