package com.boxsort.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * "This box must contain {@code requiredQty} units of this barcode for this customer."
 *
 * Quantity fields are only changed through {@link com.boxsort.service.RequirementStore}.
 */
@Entity
@Table(name = "box_requirements",
    uniqueConstraints = @UniqueConstraint(name = "uk_box_requirement",
        columnNames = {"job_id", "box_number", "bar_code"}),
    indexes = @Index(name = "idx_box_requirement_job_barcode", columnList = "job_id, bar_code"))
public class BoxRequirement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "box_number", nullable = false)
    private Integer boxNumber;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "bar_code", nullable = false, length = 128)
    private String barCode;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "required_qty", nullable = false)
    private Integer requiredQty;

    @Column(name = "fulfilled_qty", nullable = false)
    private Integer fulfilledQty = 0;

    @Column(name = "is_complete", nullable = false)
    private Boolean complete = false;

    @Column(name = "last_worker_id", length = 64)
    private String lastWorkerId;

    @Column(name = "last_worker_color", length = 16)
    private String lastWorkerColor;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public BoxRequirement() {
    }

    public BoxRequirement(String jobId, int boxNumber, String customerName, String barCode,
                          String productName, int requiredQty) {
        this.jobId = jobId;
        this.boxNumber = boxNumber;
        this.customerName = customerName;
        this.barCode = barCode;
        this.productName = productName;
        this.requiredQty = requiredQty;
    }

    public boolean canAccept() {
        return fulfilledQty < requiredQty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoxRequirement that = (BoxRequirement) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "BoxRequirement{job=" + jobId + ", box=" + boxNumber + ", barCode=" + barCode
            + ", " + fulfilledQty + "/" + requiredQty + "}";
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public Integer getBoxNumber() { return boxNumber; }
    public void setBoxNumber(Integer boxNumber) { this.boxNumber = boxNumber; }
    public String getCustomerName() { return customerName; }
    public void setCustomerName(String customerName) { this.customerName = customerName; }
    public String getBarCode() { return barCode; }
    public void setBarCode(String barCode) { this.barCode = barCode; }
    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }
    public Integer getRequiredQty() { return requiredQty; }
    public void setRequiredQty(Integer requiredQty) { this.requiredQty = requiredQty; }
    public Integer getFulfilledQty() { return fulfilledQty; }
    public void setFulfilledQty(Integer fulfilledQty) { this.fulfilledQty = fulfilledQty; }
    public Boolean getComplete() { return complete; }
    public void setComplete(Boolean complete) { this.complete = complete; }
    public String getLastWorkerId() { return lastWorkerId; }
    public void setLastWorkerId(String lastWorkerId) { this.lastWorkerId = lastWorkerId; }
    public String getLastWorkerColor() { return lastWorkerColor; }
    public void setLastWorkerColor(String lastWorkerColor) { this.lastWorkerColor = lastWorkerColor; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Long getVersion() { return version; }
}
