package io.b2mash.pms.invoice;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InvoiceNumberServiceTest {

  @Test
  void formatPadsSequenceToFourDigits() {
    assertThat(InvoiceNumberService.format(2024, 1)).isEqualTo("20240001");
    assertThat(InvoiceNumberService.format(2025, 123)).isEqualTo("20250123");
  }

  @Test
  void formatKeepsSequencesBeyondFourDigits() {
    assertThat(InvoiceNumberService.format(2024, 12345)).isEqualTo("202412345");
  }
}
