package com.grcplatform.security.audit;

import com.grcplatform.auditmodel.AuditEvent;
import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.auditmodel.ChainedAuditRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Sink keeping every record in memory. */
public class RecordingAuditSink implements AuditSink {

    private final List<ChainedAuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void write(ChainedAuditRecord record) {
        records.add(record);
    }

    public List<ChainedAuditRecord> records() {
        return records;
    }

    public List<AuditEvent> events() {
        return records.stream().map(ChainedAuditRecord::event).toList();
    }

    public List<AuditEvent> events(AuditEventType type) {
        return events().stream().filter(e -> e.eventType() == type).toList();
    }
}
