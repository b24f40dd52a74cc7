package weft;

import java.util.Arrays;

public class Util {

  public static String spaces(int cols) {
    if (cols <= 0) {
      return "";
    }
    char[] chars = new char[cols];
    Arrays.fill(chars, ' ');
    return String.valueOf(chars);
  }

  public static boolean isBlank(String s) {
    for (int i = 0, n = s.length(); i < n; i++) {
      if (!Character.isWhitespace(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Escapes line breaks and control characters for log messages. The result
   * is not a valid Java string literal.
   */
  public static String stringify(String s) {
    StringBuilder b = new StringBuilder("\"");
    for (char c : s.toCharArray()) {
      switch (c) {
        case '\n':
          b.append("\\n");
          break;
        case '\r':
          b.append("\\r");
          break;
        case '\t':
          b.append("\\t");
          break;
        default:
          if (c >= ' ' && c < 0x7f) {
            b.append(c);
          } else {
            b.append("\\u{").append(Integer.toHexString(c)).append('}');
          }
          break;
      }
    }
    return b.append('"').toString();
  }
}
