package scribe.impl.text;

public final class TextMetrics {

  public long bytesCount;
  public long charsCount;
  public long newlinesCount;

  public TextMetrics(long bytesCount, long charsCount, long newlinesCount) {
    this.bytesCount = bytesCount;
    this.charsCount = charsCount;
    this.newlinesCount = newlinesCount;
  }

  public TextMetrics() {
    this(0, 0, 0);
  }

  public void merge(TextMetrics other) {
    this.bytesCount += other.bytesCount;
    this.charsCount += other.charsCount;
    this.newlinesCount += other.newlinesCount;
  }

  public TextMetrics add(TextMetrics other) {
    return new TextMetrics(this.bytesCount + other.bytesCount,
                           this.charsCount + other.charsCount,
                           this.newlinesCount + other.newlinesCount);
  }

  @Override
  public String toString() {
    return "TextMetrics{" +
           "bytesCount=" + bytesCount +
           ", charsCount=" + charsCount +
           ", newlinesCount=" + newlinesCount +
           '}';
  }
}
