package com.gocomet.tripsafety.admission.web;

import com.gocomet.tripsafety.admission.model.EndpointClass;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller method as rate limited under the given endpoint class.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    EndpointClass value() default EndpointClass.STANDARD;
}
