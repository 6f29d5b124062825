package syncc.header;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persisted interface summary of a compiled module ({@code .dfic} file).
 */
public class CompiledHeader implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Format marker written to and expected in every compiled header. */
  public static final String FORMAT_VERSION = "1";

  public enum Provenance {
    /** Compiled from a hand-written interface file; authoritative, never regenerated. */
    FROM_INTERFACE("from_interface"),
    /** Extracted from a source module; regenerated when the source interface changes. */
    FROM_SOURCE("from_source");

    public final String serialName;
    private Provenance(String serialName) { this.serialName = serialName; }

    public static Optional<Provenance> fromSerialName(String serialName) {
      return Stream.of(Provenance.values()).filter(val -> val.serialName.equals(serialName)).findAny();
    }
    @Override
    public String toString() {
      return serialName;
    }
  }

  String formatVersion = FORMAT_VERSION;
  String compilerVersion = "";
  String provenance = "";
  /** SHA-256 of {@link ModuleInterface#canonicalText()} of {@link #contents} */
  String contentMarker = "";
  ModuleInterface contents = new ModuleInterface();

  public CompiledHeader() {}

  public static CompiledHeader create(ModuleInterface contents, Provenance provenance, String compilerVersion) {
    CompiledHeader ret = new CompiledHeader();
    ret.compilerVersion = compilerVersion;
    ret.provenance = provenance.serialName;
    ret.contents = contents;
    ret.contentMarker = contentMarker(contents);
    return ret;
  }

  public static String contentMarker(ModuleInterface contents) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(contents.canonicalText().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  public String getFormatVersion() {
    return formatVersion;
  }
  public void setFormatVersion(String formatVersion) {
    this.formatVersion = formatVersion;
  }
  public String getCompilerVersion() {
    return compilerVersion;
  }
  public void setCompilerVersion(String compilerVersion) {
    this.compilerVersion = compilerVersion;
  }
  public String getProvenance() {
    return provenance;
  }
  public void setProvenance(String provenance) {
    this.provenance = provenance;
  }
  public String getContentMarker() {
    return contentMarker;
  }
  public void setContentMarker(String contentMarker) {
    this.contentMarker = contentMarker;
  }
  public ModuleInterface getContents() {
    return contents;
  }
  public void setContents(ModuleInterface contents) {
    this.contents = contents;
  }

  /** The parsed provenance; empty if the stored name is unknown. */
  public Optional<Provenance> provenanceValue() { return Provenance.fromSerialName(provenance); }
  public boolean isFromInterface() { return provenanceValue().orElse(null) == Provenance.FROM_INTERFACE; }
}
