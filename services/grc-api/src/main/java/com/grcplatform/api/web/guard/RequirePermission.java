package com.grcplatform.api.web.guard;

import com.grcplatform.security.permission.Action;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The caller's permission set must allow every listed action on the resource.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(RequirePermissions.class)
public @interface RequirePermission {

    String resource();

    Action[] actions() default {Action.READ};
}
