package com.shoplytic.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "shipping_info", uniqueConstraints = {
    @UniqueConstraint(name = "uk_shipping_session", columnNames = {"session_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode(of = "id")
public class ShippingInfo {

    public static final int MAX_FULL_NAME = 255;
    public static final int MAX_ADDRESS = 500;
    public static final int MAX_CITY = 100;
    public static final int MAX_ZIP_CODE = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "full_name", nullable = false, length = MAX_FULL_NAME)
    private String fullName;

    @Column(nullable = false, length = MAX_ADDRESS)
    private String address;

    @Column(nullable = false, length = MAX_CITY)
    private String city;

    @Column(name = "zip_code", nullable = false, length = MAX_ZIP_CODE)
    private String zipCode;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
