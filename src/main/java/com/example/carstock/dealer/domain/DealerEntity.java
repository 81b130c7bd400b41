package com.example.carstock.dealer.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Dealer credential row. Seeded outside the API and never written by it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "hashedPassword")
@Entity(name = "Dealer")
@Table(name = "users")

public class DealerEntity {
    @Id
    @Column(name = "dealer_id")
    private Integer dealerId;

    @Column(name = "hashed_password", nullable = false)
    private String hashedPassword; // BCrypt
}
