package ca.gc.cra.clipstitch.domain.media;

import java.util.Locale;

/**
 * Elementary stream category of a container track, derived from the ISO handler type.
 *
 * @since 0.1.0
 */
public enum MediaType {
  /** Video track ({@code vide}). */
  VIDEO("vide"),
  /** Audio track ({@code soun}). */
  AUDIO("soun"),
  /** Timed text or subtitle track ({@code text}, {@code sbtl}, {@code subt}). */
  TEXT("text"),
  /** Any other handler (hint, metadata, ...). */
  OTHER("");

  private final String handler;

  MediaType(String handler) {
    this.handler = handler;
  }

  /**
   * Returns the canonical four-character handler type for this category.
   *
   * @return handler type, empty for {@link #OTHER}
   */
  public String handler() {
    return handler;
  }

  /**
   * Maps a four-character handler type onto a media category.
   *
   * @param handler handler type as stored in the {@code hdlr} box; {@code null} maps to {@link #OTHER}
   * @return matching category
   */
  public static MediaType fromHandler(String handler) {
    if (handler == null) {
      return OTHER;
    }
    return switch (handler.trim().toLowerCase(Locale.ROOT)) {
      case "vide" -> VIDEO;
      case "soun" -> AUDIO;
      case "text", "sbtl", "subt" -> TEXT;
      default -> OTHER;
    };
  }
}
