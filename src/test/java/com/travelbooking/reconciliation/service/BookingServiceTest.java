package com.travelbooking.reconciliation.service;

import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.BookingStatus;
import com.travelbooking.reconciliation.exception.BookingNotFoundException;
import com.travelbooking.reconciliation.exception.StateConflictException;
import com.travelbooking.reconciliation.repository.BookingRepository;
import com.travelbooking.reconciliation.support.TestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @InjectMocks
    private BookingService bookingService;

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"PENDING", "CONFIRMED"})
    @DisplayName("Should cancel an open booking")
    void shouldCancelOpenBooking(BookingStatus status) {
        Booking booking = TestData.booking().id(42L).status(status).build();
        when(bookingRepository.findByIdWithLock(42L)).thenReturn(Optional.of(booking));
        when(bookingRepository.save(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Booking cancelled = bookingService.cancelBooking(42L);

        assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"CANCELLED", "COMPLETED"})
    @DisplayName("Should refuse to cancel a closed booking")
    void shouldRefuseClosedBooking(BookingStatus status) {
        Booking booking = TestData.booking().id(42L).status(status).build();
        when(bookingRepository.findByIdWithLock(42L)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> bookingService.cancelBooking(42L))
                .isInstanceOf(StateConflictException.class)
                .hasMessage("Cannot cancel a booking that is already " + status.name().toLowerCase());
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should throw when the booking does not exist")
    void shouldThrowWhenMissing() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.getBooking(42L))
                .isInstanceOf(BookingNotFoundException.class);
    }
}
