package com.grcplatform.api.web.guard;

import com.grcplatform.security.quota.QuotaType;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Checks the tenant's quotas before the handler runs. An {@code api_calls} check also charges
 * the call.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnforceQuota {

    QuotaType[] value() default {QuotaType.API_CALLS};
}
