package com.boxsort.model;

/**
 * State change pushed to every observer of a job after a scan or undo.
 *
 * {@code boxNumber} and the quantity fields are null when the scan was not
 * placed in a box (extra item or error). {@code rowVersion} is the requirement
 * row's version after the change; a higher version for the same box and barcode
 * supersedes a lower one.
 */
public record BoxDelta(
    String jobId,
    Long sessionId,
    String workerId,
    Integer boxNumber,
    String barCode,
    String customerName,
    String productName,
    Integer fulfilledQty,
    Integer requiredQty,
    Boolean complete,
    String workerColor,
    ScanEventType eventType,
    Long rowVersion
) {

    public static BoxDelta forBox(BoxRequirement box, ScanSession session, String workerColor,
                                  ScanEventType eventType) {
        return new BoxDelta(box.getJobId(), session.getId(), session.getWorkerId(), box.getBoxNumber(),
            box.getBarCode(), box.getCustomerName(), box.getProductName(), box.getFulfilledQty(),
            box.getRequiredQty(), box.getComplete(), workerColor, eventType, box.getVersion());
    }

    public static BoxDelta forUnplaced(ScanEvent event, ScanSession session) {
        return new BoxDelta(session.getJobId(), session.getId(), session.getWorkerId(), null,
            event.getBarCode(), event.getCustomerName(), event.getProductName(), null, null, null,
            event.getWorkerColor(), event.getEventType(), null);
    }

    /**
     * Key of the requirement row this delta describes, or null for an unplaced scan.
     */
    public String rowKey() {
        return boxNumber != null ? boxNumber + ":" + barCode : null;
    }
}
