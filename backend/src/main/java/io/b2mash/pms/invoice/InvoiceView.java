package io.b2mash.pms.invoice;

/** An invoice with the display fields of its client and project. */
public record InvoiceView(
    Invoice invoice, String clientName, String clientEmail, String projectName) {}
