package com.grcplatform.api.web.guard;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The caller must be allowed to access the addressed resource instance.
 *
 * <p>The resource id is read from the path variable named by {@link #idParam()}, falling back to
 * the query parameter of the same name.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireResourceAccess {

    /** Resource type, e.g. {@code agent}. */
    String type();

    String idParam() default "id";
}
