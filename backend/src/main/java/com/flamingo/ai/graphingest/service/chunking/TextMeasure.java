package com.flamingo.ai.graphingest.service.chunking;

/** Maps unit budgets onto character offsets of a fixed text. */
interface TextMeasure {

  /** Size of {@code text[start, end)} in units. */
  int size(int start, int end);

  /**
   * Largest end offset such that {@code text[start, end)} fits in {@code units}. Always greater
   * than {@code start} while {@code start} is before the end of the text.
   */
  int advance(int start, int units);

  /** Smallest start offset such that {@code text[start, end)} fits in {@code units}. */
  int retreat(int end, int units);

  static TextMeasure characters(String text) {
    int length = text.length();
    return new TextMeasure() {
      @Override
      public int size(int start, int end) {
        return end - start;
      }

      @Override
      public int advance(int start, int units) {
        return (int) Math.min((long) start + Math.max(units, 1), length);
      }

      @Override
      public int retreat(int end, int units) {
        return Math.max(0, end - units);
      }
    };
  }

  static TextMeasure tokens(String text, TokenCounter counter) {
    return new TokenMeasure(text, counter);
  }

  /**
   * Token measure that gallops outward from the boundary then binary-searches, so each boundary
   * costs a logarithmic number of counter calls over ranges no longer than about twice the window.
   * Assumes the count never shrinks when a range grows.
   */
  final class TokenMeasure implements TextMeasure {

    private final String text;
    private final TokenCounter counter;

    TokenMeasure(String text, TokenCounter counter) {
      this.text = text;
      this.counter = counter;
    }

    @Override
    public int size(int start, int end) {
      return counter.count(text.substring(start, end));
    }

    @Override
    public int advance(int start, int units) {
      int length = text.length();
      int fits = start;
      int step = Math.max(units, 1);
      int over;
      while (true) {
        int probe = (int) Math.min((long) fits + step, length);
        if (size(start, probe) > units) {
          over = probe;
          break;
        }
        if (probe >= length) {
          return length;
        }
        fits = probe;
        step *= 2;
      }
      // fits satisfies the budget, over does not
      while (over - fits > 1) {
        int mid = (fits + over) >>> 1;
        if (size(start, mid) <= units) {
          fits = mid;
        } else {
          over = mid;
        }
      }
      return fits > start ? fits : start + 1;
    }

    @Override
    public int retreat(int end, int units) {
      if (units <= 0) {
        return end;
      }
      int fits = end;
      int step = units;
      int over;
      while (true) {
        int probe = Math.max(fits - step, 0);
        if (size(probe, end) > units) {
          over = probe;
          break;
        }
        if (probe <= 0) {
          return 0;
        }
        fits = probe;
        step *= 2;
      }
      while (fits - over > 1) {
        int mid = (fits + over) >>> 1;
        if (size(mid, end) <= units) {
          fits = mid;
        } else {
          over = mid;
        }
      }
      return fits;
    }
  }
}
