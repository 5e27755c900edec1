package org.catalogapi.export.sierra.model;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRow {
    private Instant dueDate;
    private Instant checkoutDate;
    private Instant overdueDate;
    private Instant recallDate;
    private Integer loanRule;
    private Integer renewalCount;
    private Integer overdueCount;
}
