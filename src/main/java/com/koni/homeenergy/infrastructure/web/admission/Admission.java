package com.koni.homeenergy.infrastructure.web.admission;

import com.koni.homeenergy.infrastructure.resilience.AdmissionTier;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Puts a controller method behind the given admission tier.
 * Handlers without it are not rate limited.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Admission {

    AdmissionTier value();
}
