package com.travelbooking.reconciliation.dto;

import com.travelbooking.reconciliation.entity.Booking;
import com.travelbooking.reconciliation.entity.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingResponse {

    private Long id;
    private Long listingId;
    private String guestEmail;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private Integer numGuests;
    private long durationDays;
    private BigDecimal totalPrice;
    private BookingStatus status;

    public static BookingResponse from(Booking booking) {
        return BookingResponse.builder()
                .id(booking.getId())
                .listingId(booking.getListingId())
                .guestEmail(booking.getGuestEmail())
                .checkInDate(booking.getCheckInDate())
                .checkOutDate(booking.getCheckOutDate())
                .numGuests(booking.getNumGuests())
                .durationDays(booking.getDurationDays())
                .totalPrice(booking.getTotalPrice())
                .status(booking.getStatus())
                .build();
    }
}
