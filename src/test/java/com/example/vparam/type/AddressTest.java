package com.example.vparam.type;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class AddressTest {

  private static final String SECRET = "s3cret";
  private static final String SIGNED = "Moscow : 37.6 , 55.7 [09054d5a7cd4091608d428fbbc779dab]";

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void parsesTextForm() {
    Address address = Address.parse(SIGNED, mapper);

    assertThat(address.getAddress()).isEqualTo("Moscow");
    assertThat(address.longitude()).isEqualTo(37.6);
    assertThat(address.latitude()).isEqualTo(55.7);
    assertThat(address.getMd5()).isEqualTo("09054d5a7cd4091608d428fbbc779dab");
  }

  @Test
  void parsesJsonForm() {
    Address address = Address.parse("[42, \"h\", \"Moscow\", 37.6, 55.7, \"ru\", \"extra\"]", mapper);

    assertThat(address.getId()).isEqualTo("42");
    assertThat(address.getType()).isEqualTo("h");
    assertThat(address.getLang()).isEqualTo("ru");
    assertThat(address.getFullname()).isEqualTo("Moscow : 37.6 , 55.7");
    assertThat(address.isExtra()).isTrue();
    assertThat(address.isNear()).isFalse();
  }

  @Test
  void signatureIsCheckedOnlyWithSecret() {
    assertThat(Address.validate(Address.parse(SIGNED, mapper), SECRET)).isNull();
    assertThat(Address.validate(Address.parse("Moscow : 37.6 , 55.7 [deadbeef]", mapper), SECRET))
        .isEqualTo("Unknown source");
    assertThat(Address.validate(Address.parse("Moscow : 37.6 , 55.7", mapper), "")).isNull();
  }

  @Test
  void trustedSourceNeedsNoSignature() {
    Address address = Address.parse("[1, \"p\", \"Moscow\", 37.6, 55.7]", mapper);

    assertThat(Address.validate(address, SECRET)).isNull();
  }

  @Test
  void malformedInput() {
    assertThat(Address.validate(Address.parse("just text", mapper), "")).isEqualTo("Wrong format");
    assertThat(Address.validate(Address.parse("[broken", mapper), "")).isEqualTo("Wrong format");
    assertThat(Address.validate(Address.parse("Moscow : 37.6 , 95.1", mapper), ""))
        .isEqualTo("Value should not be greater than 90°");
    assertThat(Address.validate(null, "")).isEqualTo("Value not defined");
  }
}
