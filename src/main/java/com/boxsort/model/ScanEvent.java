package com.boxsort.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Append-only audit record of one classified scan or undo. There are no setters:
 * a correction is always a new record.
 */
@Entity
@Table(name = "scan_events",
    indexes = @Index(name = "idx_event_session_time", columnList = "session_id, scan_time"))
public class ScanEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "bar_code", nullable = false, updatable = false, length = 128)
    private String barCode;

    @Column(name = "product_name", updatable = false)
    private String productName;

    @Column(name = "customer_name", updatable = false)
    private String customerName;

    @Column(name = "box_number", updatable = false)
    private Integer boxNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 16)
    private ScanEventType eventType;

    @Column(name = "scan_time", nullable = false, updatable = false)
    private Instant scanTime;

    @Column(name = "time_since_previous_ms", updatable = false)
    private Long timeSincePreviousMs;

    @Column(name = "worker_color", updatable = false, length = 16)
    private String workerColor;

    protected ScanEvent() {
    }

    private ScanEvent(Builder builder) {
        this.sessionId = builder.sessionId;
        this.barCode = builder.barCode;
        this.productName = builder.productName;
        this.customerName = builder.customerName;
        this.boxNumber = builder.boxNumber;
        this.eventType = builder.eventType;
        this.scanTime = builder.scanTime;
        this.timeSincePreviousMs = builder.timeSincePreviousMs;
        this.workerColor = builder.workerColor;
    }

    public static Builder builder(Long sessionId, String barCode, ScanEventType eventType) {
        return new Builder(sessionId, barCode, eventType);
    }

    public boolean isExtraItem() {
        return eventType == ScanEventType.EXTRA_ITEM;
    }

    public Long getId() { return id; }
    public Long getSessionId() { return sessionId; }
    public String getBarCode() { return barCode; }
    public String getProductName() { return productName; }
    public String getCustomerName() { return customerName; }
    public Integer getBoxNumber() { return boxNumber; }
    public ScanEventType getEventType() { return eventType; }
    public Instant getScanTime() { return scanTime; }
    public Long getTimeSincePreviousMs() { return timeSincePreviousMs; }
    public String getWorkerColor() { return workerColor; }

    public static final class Builder {
        private final Long sessionId;
        private final String barCode;
        private final ScanEventType eventType;
        private String productName;
        private String customerName;
        private Integer boxNumber;
        private Instant scanTime;
        private Long timeSincePreviousMs;
        private String workerColor;

        private Builder(Long sessionId, String barCode, ScanEventType eventType) {
            this.sessionId = sessionId;
            this.barCode = barCode;
            this.eventType = eventType;
        }

        public Builder product(String productName, String customerName) {
            this.productName = productName;
            this.customerName = customerName;
            return this;
        }

        public Builder boxNumber(Integer boxNumber) {
            this.boxNumber = boxNumber;
            return this;
        }

        public Builder scanTime(Instant scanTime) {
            this.scanTime = scanTime;
            return this;
        }

        public Builder timeSincePreviousMs(Long timeSincePreviousMs) {
            this.timeSincePreviousMs = timeSincePreviousMs;
            return this;
        }

        public Builder workerColor(String workerColor) {
            this.workerColor = workerColor;
            return this;
        }

        public ScanEvent build() {
            if (sessionId == null || barCode == null || eventType == null || scanTime == null) {
                throw new IllegalStateException("sessionId, barCode, eventType and scanTime are required");
            }
            return new ScanEvent(this);
        }
    }
}
