package com.travelbooking.reconciliation.notification;

import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.repository.BookingRepository;
import com.travelbooking.reconciliation.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Renders guest-facing text for a notification event from current payment and booking data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationMessageFactory {

    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;

    /**
     * @return the message, or empty when the event no longer applies (record gone,
     *         or a confirmation for a payment that is not completed)
     */
    @Transactional(readOnly = true)
    public Optional<NotificationMessage> render(NotificationEvent event) {
        switch (event.getType()) {
            case PAYMENT_CONFIRMED:
                return paymentRepository.findById(event.getPaymentId())
                        .filter(payment -> {
                            if (!payment.isSuccessful()) {
                                log.warn("Payment {} is not completed, skipping confirmation", payment.getId());
                                return false;
                            }
                            return true;
                        })
                        .map(this::paymentConfirmed);
            case PAYMENT_FAILED:
                return paymentRepository.findById(event.getPaymentId())
                        .map(payment -> paymentFailed(payment, event.getReason()));
            case BOOKING_AWAITING_PAYMENT:
                return bookingRepository.findById(event.getBookingId())
                        .map(this::bookingAwaitingPayment);
            default:
                return Optional.empty();
        }
    }

    private NotificationMessage paymentConfirmed(Payment payment) {
        Booking booking = payment.getBooking();
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            return paymentReceivedForCancelledBooking(payment, booking);
        }
        String body = String.format(
                "Dear %s,%n%n" +
                "Thank you for your payment! Your booking has been confirmed.%n%n" +
                "Booking ID: #%d%n" +
                "Check-in: %s%n" +
                "Check-out: %s%n" +
                "Guests: %d%n" +
                "Amount paid: %s %s%n" +
                "Payment ID: %s%n" +
                "Transaction reference: %s%n" +
                "Paid at: %s%n",
                greetingName(booking), booking.getId(), booking.getCheckInDate(), booking.getCheckOutDate(),
                booking.getNumGuests(), payment.getAmount().toPlainString(), payment.getCurrency(),
                payment.getPaymentId(), payment.getTxRef(),
                payment.getPaidAt() != null ? payment.getPaidAt() : payment.getUpdatedAt());

        return NotificationMessage.builder()
                .type(NotificationType.PAYMENT_CONFIRMED)
                .recipient(booking.getGuestEmail())
                .subject("Payment Confirmation - Booking #" + booking.getId())
                .body(body)
                .build();
    }

    // The booking was cancelled before the payment settled, so it is not confirmed.
    private NotificationMessage paymentReceivedForCancelledBooking(Payment payment, Booking booking) {
        String body = String.format(
                "Dear %s,%n%n" +
                "We have received your payment, but your booking #%d was cancelled before it settled.%n" +
                "Our team will contact you about a refund or rebooking.%n%n" +
                "Amount paid: %s %s%n" +
                "Payment ID: %s%n" +
                "Transaction reference: %s%n",
                greetingName(booking), booking.getId(), payment.getAmount().toPlainString(),
                payment.getCurrency(), payment.getPaymentId(), payment.getTxRef());

        return NotificationMessage.builder()
                .type(NotificationType.PAYMENT_CONFIRMED)
                .recipient(booking.getGuestEmail())
                .subject("Payment Received - Booking #" + booking.getId() + " Cancelled")
                .body(body)
                .build();
    }

    private NotificationMessage paymentFailed(Payment payment, String reason) {
        Booking booking = payment.getBooking();
        String effectiveReason = reason != null ? reason : payment.getFailureReason();
        String body = String.format(
                "Dear %s,%n%n" +
                "We're sorry to inform you that your payment for booking #%d was not successful.%n%n" +
                "Check-in: %s%n" +
                "Check-out: %s%n" +
                "Total amount: %s %s%n%n" +
                "Reason: %s%n%n" +
                "You can try again or contact support for assistance.%n",
                greetingName(booking), booking.getId(), booking.getCheckInDate(), booking.getCheckOutDate(),
                payment.getAmount().toPlainString(), payment.getCurrency(), effectiveReason);

        return NotificationMessage.builder()
                .type(NotificationType.PAYMENT_FAILED)
                .recipient(booking.getGuestEmail())
                .subject("Payment Failed - Booking #" + booking.getId())
                .body(body)
                .build();
    }

    private NotificationMessage bookingAwaitingPayment(Booking booking) {
        String body = String.format(
                "Dear %s,%n%n" +
                "Your booking request has been received and is being processed.%n%n" +
                "Booking ID: #%d%n" +
                "Check-in: %s%n" +
                "Check-out: %s%n" +
                "Guests: %d%n" +
                "Total amount: %s%n" +
                "Status: %s%n%n" +
                "Please complete your payment to confirm your reservation.%n",
                greetingName(booking), booking.getId(), booking.getCheckInDate(), booking.getCheckOutDate(),
                booking.getNumGuests(), booking.getTotalPrice().toPlainString(), booking.getStatus());

        return NotificationMessage.builder()
                .type(NotificationType.BOOKING_AWAITING_PAYMENT)
                .recipient(booking.getGuestEmail())
                .subject("Booking Confirmation - #" + booking.getId())
                .body(body)
                .build();
    }

    private String greetingName(Booking booking) {
        String firstName = booking.getGuestFirstName();
        return firstName == null || firstName.isBlank() ? booking.getGuestEmail() : firstName;
    }
}
