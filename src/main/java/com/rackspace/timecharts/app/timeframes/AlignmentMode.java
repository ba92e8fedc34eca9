package com.rackspace.timecharts.app.timeframes;

/**
 * How unit boundaries are placed. {@link #ROLLING} boundaries are whole units away from an
 * anchor, such as the seven days ending now. {@link #QUANTIZED} boundaries sit on calendar
 * edges, such as midnight or the first of the month.
 */
public enum AlignmentMode {
  ROLLING,
  QUANTIZED;

  public static AlignmentMode of(boolean quantize) {
    return quantize ? QUANTIZED : ROLLING;
  }
}
