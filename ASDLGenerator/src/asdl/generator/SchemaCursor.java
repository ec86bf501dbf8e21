package asdl.generator;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

public final class SchemaCursor {

  @AutoValue
  public abstract static class Pos {
    public abstract int line();

    public abstract int column();

    public static Pos create(int line, int column) {
      return new AutoValue_SchemaCursor_Pos(line, column);
    }

    @Override
    public String toString() {
      return line() + ":" + column();
    }
  }

  private final String text;
  private final int end;
  private int position;

  SchemaCursor(String text, int start, int end) {
    Preconditions.checkPositionIndexes(start, end, text.length());
    this.text = text;
    this.position = start;
    this.end = end;
  }

  Optional<MatchResult> consume(Pattern pattern) {
    Matcher m = matcher(pattern);
    if (!m.lookingAt()) return Optional.empty();

    position = m.end();
    return Optional.of(m.toMatchResult());
  }

  boolean lookingAt(Pattern pattern) {
    return matcher(pattern).lookingAt();
  }

  boolean atEnd() {
    return CharMatcher.whitespace().matchesAllOf(text.subSequence(position, end));
  }

  Pos pos() {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < position; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return Pos.create(line, position - lineStart + 1);
  }

  private Matcher matcher(Pattern pattern) {
    return pattern.matcher(text).region(position, end);
  }
}
