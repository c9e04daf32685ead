package com.tinytasks.api.task;

final class TaskTitles {

  static final int MAX_LENGTH = 140;

  private TaskTitles() {
  }

  /**
   * Returns the stored form of a client-supplied title: surrounding whitespace removed.
   * Whitespace is the Unicode White_Space set, so no-break spaces and NEL count too.
   * Length is counted in code points.
   *
   * @throws TaskValidationException if the title is missing, blank, or longer than {@value #MAX_LENGTH}
   */
  static String normalize(String raw) {
    if (raw == null) {
      throw TaskValidationException.invalid("title", "title is required");
    }
    String title = strip(raw);
    if (title.isEmpty()) {
      throw TaskValidationException.invalid("title", "title must not be blank");
    }
    if (title.codePointCount(0, title.length()) > MAX_LENGTH) {
      throw TaskValidationException.invalid("title", "title must be at most " + MAX_LENGTH + " characters");
    }
    return title;
  }

  static String strip(String raw) {
    int start = 0;
    int end = raw.length();
    while (start < end) {
      int cp = raw.codePointAt(start);
      if (!isWhitespace(cp)) break;
      start += Character.charCount(cp);
    }
    while (end > start) {
      int cp = raw.codePointBefore(end);
      if (!isWhitespace(cp)) break;
      end -= Character.charCount(cp);
    }
    return raw.substring(start, end);
  }

  // Character.isWhitespace alone skips U+00A0, U+2007, U+202F and U+0085
  private static boolean isWhitespace(int cp) {
    return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
  }
}
