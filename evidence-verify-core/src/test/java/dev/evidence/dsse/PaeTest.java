package dev.evidence.dsse;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class PaeTest {

  @Test
  public void encodesTypeAndBodyWithByteLengths() {
    byte[] encoded = Pae.encode("http://example.com/HelloWorld", "hello world".getBytes(UTF_8));

    assertThat(new String(encoded, UTF_8)).isEqualTo("DSSEv1 29 http://example.com/HelloWorld 11 hello world");
  }

  @Test
  public void countsBytesNotCharacters() {
    byte[] encoded = Pae.encode("t", "é".getBytes(UTF_8));

    assertThat(new String(encoded, UTF_8)).isEqualTo("DSSEv1 1 t 2 é");
  }

  @Test
  public void encodesEmptyBody() {
    assertThat(new String(Pae.encode("", new byte[0]), UTF_8)).isEqualTo("DSSEv1 0  0 ");
  }
}
