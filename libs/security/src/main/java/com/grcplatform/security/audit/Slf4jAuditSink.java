package com.grcplatform.security.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grcplatform.auditmodel.AuditEventSerializer;
import com.grcplatform.auditmodel.ChainedAuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each audit record as one JSON line to the {@code grc.audit} logger, for shipping by the
 * log pipeline.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "grc.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper mapper = AuditEventSerializer.objectMapper();

    @Override
    public void write(ChainedAuditRecord record) {
        try {
            audit.info(mapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new AuditEventSerializer.AuditSerializationException(
                    "Failed to serialize audit record " + record.sequence(), e);
        }
    }
}
