package com.openparking.parking.notification;

/**
 * Subject and plain-text body of an outgoing email.
 */
public record MailMessage(String subject, String body) {

    public static MailMessage slotApproved(String name, String plateNumber, String slotNumber, String location) {
        String body = "Dear " + name + ",\n\n"
                + "Your parking slot request for vehicle " + plateNumber + " has been approved.\n"
                + "Assigned slot: " + slotNumber
                + (location != null ? " (" + location + ")" : "") + "\n\n"
                + "Thank you.";
        return new MailMessage("Parking Slot Approved!", body);
    }

    public static MailMessage slotRejected(String name, String plateNumber, String reason) {
        StringBuilder body = new StringBuilder()
                .append("Dear ").append(name).append(",\n\n")
                .append("We regret to inform you that your parking slot request for vehicle ")
                .append(plateNumber).append(" has been rejected.\n");
        if (reason != null && !reason.isBlank()) {
            body.append("Reason: ").append(reason).append('\n');
        }
        body.append("\nPlease contact support if you have any questions.\n\nThank you.");
        return new MailMessage("Parking Slot Request Rejected", body.toString());
    }
}
