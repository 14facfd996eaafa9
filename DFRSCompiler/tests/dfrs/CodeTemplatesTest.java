package dfrs;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.io.BaseEncoding;

public class CodeTemplatesTest {

  @Test
  public void compressedTemplatesAreGzipInBase64() {
    String compressed = CodeTemplates.compress("{\"blocks\":[]}");
    byte[] bytes = BaseEncoding.base64().decode(compressed);

    // gzip magic number
    assertThat(bytes[0]).isEqualTo((byte) 0x1f);
    assertThat(bytes[1]).isEqualTo((byte) 0x8b);
    assertThat(CodeTemplates.decompress(compressed)).isEqualTo("{\"blocks\":[]}");
  }

  @Test
  public void unicodeSurvives() {
    String json = "{\"name\":\"§aGrüße ✓\"}";

    assertThat(CodeTemplates.decompress(CodeTemplates.compress(json))).isEqualTo(json);
  }

  @Test
  public void surroundingWhitespaceIsIgnored() {
    String compressed = CodeTemplates.compress("{}");

    assertThat(CodeTemplates.decompress("  " + compressed + "\n")).isEqualTo("{}");
  }

  @Test
  public void invalidTemplates() {
    assertThrows(IllegalArgumentException.class, () -> CodeTemplates.decompress("***"));
    String notGzip = BaseEncoding.base64().encode("plain text".getBytes(UTF_8));
    assertThrows(IllegalArgumentException.class, () -> CodeTemplates.decompress(notGzip));
  }

  @Test
  public void detectsRawJson() {
    assertThat(CodeTemplates.isJson("  {\"blocks\":[]}")).isTrue();
    assertThat(CodeTemplates.isJson(CodeTemplates.compress("{}"))).isFalse();
  }
}
