package ca.gc.cra.netprov.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateManagementAddressStripsPrefixLength() {
    assertEquals("192.0.2.10", Net.validateManagementAddress("192.0.2.10/24"));
  }

  @Test
  void validateManagementAddressHandlesHostname() {
    assertEquals("leaf-1.lab.example", Net.validateManagementAddress(" leaf-1.lab.example "));
  }

  @Test
  void validateManagementAddressHandlesIpv6() {
    assertEquals("2001:db8::1", Net.validateManagementAddress("2001:db8::1/64"));
    assertEquals("2001:db8::1", Net.validateManagementAddress("[2001:db8::1]"));
  }

  @Test
  void validateManagementAddressRejectsOctetOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateManagementAddress("192.0.2.300"));
  }

  @Test
  void validateManagementAddressRejectsMalformedHostname() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateManagementAddress("-leaf1"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateManagementAddress("leaf1..lab"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateManagementAddress("leaf1 lab"));
  }

  @Test
  void validateManagementAddressRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateManagementAddress("  "));
  }
}
