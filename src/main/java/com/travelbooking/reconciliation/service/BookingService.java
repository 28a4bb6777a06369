package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.exception.BookingNotFoundException;
import com.travelbooking.reconciliation.exception.StateConflictException;
import com.travelbooking.reconciliation.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;

    @Transactional(readOnly = true)
    public Booking getBooking(Long id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new BookingNotFoundException(id));
    }

    /**
     * Cancels a booking. Takes the booking row lock so a cancel cannot interleave with
     * payment creation for the same booking.
     *
     * @throws StateConflictException if the booking is already cancelled or completed
     */
    @Transactional
    public Booking cancelBooking(Long id) {
        Booking booking = bookingRepository.findByIdWithLock(id)
                .orElseThrow(() -> new BookingNotFoundException(id));

        if (!booking.isCancellable()) {
            throw new StateConflictException(String.format(
                    "Cannot cancel a booking that is already %s",
                    booking.getStatus().name().toLowerCase(Locale.ROOT)));
        }

        BookingStatus previous = booking.getStatus();
        booking.setStatus(BookingStatus.CANCELLED);
        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} cancelled (was {})", id, previous);
        return saved;
    }
}
