package com.ai.hospital.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;

import java.time.LocalDateTime;

/**
 * Single row holding the id counter. Its version is the store version every commit checks;
 * {@code revision} changes on every commit so the row is always dirty and the version always moves.
 */
@Entity
@Table(name = "store_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreState {

    @Id
    private Long id;

    @Column(nullable = false)
    private long counter;

    @ColumnDefault("0")
    @Column(nullable = false)
    private long revision;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    @Version
    private Long version;
}
