package org.catalogapi.export.sierra.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A Sierra item record with its related rows already fetched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemSourceRecord {

    private RecordMetadata metadata;

    private Integer copyNumber;

    private Instant lastCheckin;

    /**
     * Null when the item's location code has no location row
     */
    private CodedProperty location;

    /**
     * ICODE1
     */
    private Integer giftStats;

    /**
     * ICODE2
     */
    private String suppressCode;

    private Integer checkinStatGroup;
    private Integer checkoutStatGroup;

    private CodedProperty status;

    private CodedProperty itype;

    private BigDecimal price;

    private Integer checkoutTotal;
    private Integer lastYtdCheckoutTotal;
    private Integer ytdCheckoutTotal;
    private Integer internalUseCount;
    private Integer copyUseCount;
    private Integer use3Count;

    private String itemMessageCode;
    private String opacMessageCode;

    /**
     * At most one current checkout
     */
    @Builder.Default
    private List<CheckoutRow> checkouts = new ArrayList<>();

    /**
     * The bib this item is attached to, used for call number fallback
     */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BibSourceRecord linkedBib;
}
