package io.github.suppierk.generator.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class ContentAddressTest {
  static final GeneratedVehicle SUV =
      new GeneratedVehicle(VehicleType.SUV, PowerSource.ELECTRIC, 200, 2023, 180);

  @Test
  void canonical_form_joins_labels_and_numbers() {
    assertEquals("SUV|Electric|200|2023|180", SUV.canonicalForm());
  }

  @Test
  void address_is_sha256_of_the_canonical_form() {
    assertEquals(
        "a7b69191830479a1d11055494105022dac491db54a54847bc9954ee7129aface",
        ContentAddress.of(SUV));
  }

  @Test
  void equal_vehicles_share_an_address() {
    assertEquals(
        ContentAddress.of(SUV),
        ContentAddress.of(
            new GeneratedVehicle(VehicleType.SUV, PowerSource.ELECTRIC, 200, 2023, 180)));
  }

  @Test
  void every_field_takes_part_in_the_address() {
    final List<GeneratedVehicle> variants =
        List.of(
            new GeneratedVehicle(VehicleType.SEDAN, PowerSource.ELECTRIC, 200, 2023, 180),
            new GeneratedVehicle(VehicleType.SUV, PowerSource.GAS, 200, 2023, 180),
            new GeneratedVehicle(VehicleType.SUV, PowerSource.ELECTRIC, 201, 2023, 180),
            new GeneratedVehicle(VehicleType.SUV, PowerSource.ELECTRIC, 200, 2022, 180),
            new GeneratedVehicle(VehicleType.SUV, PowerSource.ELECTRIC, 200, 2023, 181));

    for (GeneratedVehicle variant : variants) {
      assertNotEquals(ContentAddress.of(SUV), ContentAddress.of(variant), variant.toString());
    }
  }

  @Test
  void null_vehicle_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> ContentAddress.of(null));
  }
}
