package com.eyelevel.bordereaux.model;

import com.eyelevel.bordereaux.model.converter.StringMapJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * A persisted canonical row. Only rows that passed validation are stored.
 */
@Entity
@Table(name = "bordereaux_row", indexes = @Index(name = "idx_bordereaux_row_file", columnList = "file_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BordereauxRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false)
    private BordereauxFile file;

    @Column(nullable = false)
    private Integer rowIndex;

    private String policyNumber;

    private String insuredName;

    private LocalDate inceptionDate;

    private LocalDate expiryDate;

    @Column(precision = 19, scale = 4)
    private BigDecimal premiumAmount;

    @Column(length = 3)
    private String currency;

    @Column(precision = 19, scale = 4)
    private BigDecimal claimAmount;

    @Column(precision = 19, scale = 4)
    private BigDecimal commissionAmount;

    @Column(precision = 19, scale = 4)
    private BigDecimal netPremium;

    private String brokerName;

    private String productType;

    private String coverageType;

    private String riskLocation;

    @Convert(converter = StringMapJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> rawData;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
