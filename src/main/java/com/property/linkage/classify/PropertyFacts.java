package com.property.linkage.classify;

/**
 * Raw registry values the classifier and scorer read. Any field may be null.
 *
 * @param ownerName          full owner name
 * @param grantorName        previous owner
 * @param address            property address
 * @param mailingAddress     owner mailing address
 * @param ownerOccupiedFlag  explicit owner-occupied column value, when the registry carries one
 * @param lastSaleDate       last sale date as exported
 * @param lastSaleAmount     last sale amount as exported, possibly with {@code $} and commas
 * @param lastCashBuyer      cash buyer indicator as exported
 */
public record PropertyFacts(
        String ownerName,
        String grantorName,
        String address,
        String mailingAddress,
        String ownerOccupiedFlag,
        String lastSaleDate,
        String lastSaleAmount,
        String lastCashBuyer
) {
}
