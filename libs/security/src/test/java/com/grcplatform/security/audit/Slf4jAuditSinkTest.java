package com.grcplatform.security.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.grcplatform.auditmodel.AuditChain;
import com.grcplatform.auditmodel.AuditEventFactory;
import com.grcplatform.auditmodel.AuditEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Slf4jAuditSink")
class Slf4jAuditSinkTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger auditLogger = (Logger) LoggerFactory.getLogger(Slf4jAuditSink.LOGGER_NAME);

    @BeforeEach
    void attach() {
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        auditLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("writes one JSON line per record to the grc.audit logger")
    void writesJson() {
        var event = AuditEventFactory.create(AuditEventType.CROSS_TENANT_ACCESS_ATTEMPT, "u-1",
                "t-1", Map.of("requestedTenants", "x"), null, Clock.systemUTC());

        new Slf4jAuditSink().write(new AuditChain().append(event));

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getFormattedMessage())
                .startsWith("{")
                .contains("\"eventType\":\"cross_tenant_access_attempt\"")
                .contains("\"sequence\":1")
                .contains("\"previousHash\":\"" + AuditChain.GENESIS_HASH + "\"");
    }
}
