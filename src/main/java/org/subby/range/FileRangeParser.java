package org.subby.range;

import java.text.ParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.primitives.Longs;

/**
 * Parses file ranges of the form <code>name[:start-end]</code>. The bounds are either both line indexes (<code>#n</code> or <code>n</code>)
 * or both timestamps (<code>hh:mm:ss,mmm</code>). <code>start</code> may stand for the first bound and <code>end</code> for the last.
 */
public class FileRangeParser {
	/** Separates the file name from the range */
	public static final char RANGE_SEPARATOR = ':';
	/** Separates the start of a range from its end */
	public static final char BOUND_SEPARATOR = '-';

	private static final Pattern TIMESTAMP = Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2}),(\\d{1,3})");
	private static final String START = "start";
	private static final String END = "end";

	private static final long SECOND = 1000;
	private static final long MINUTE = 60 * SECOND;
	private static final long HOUR = 60 * MINUTE;

	private FileRangeParser() {}

	/**
	 * @param text The text to parse
	 * @return The file range
	 * @throws ParseException If the range portion of the text cannot be parsed
	 */
	public static FileRange parse(String text) throws ParseException {
		int sep = text.indexOf(RANGE_SEPARATOR);
		if (sep < 0)
			return FileRange.whole(text);
		String fileName = text.substring(0, sep);
		String range = text.substring(sep + 1);
		int boundSep = range.indexOf(BOUND_SEPARATOR);
		if (boundSep < 0 || range.indexOf(BOUND_SEPARATOR, boundSep + 1) >= 0)
			throw new ParseException("Range '" + range + "' needs to be formatted as hh:mm:ss,mmm-hh:mm:ss,mmm or #n-#n", sep + 1);
		String start = range.substring(0, boundSep);
		String end = range.substring(boundSep + 1);

		FileRange lines = parseLines(fileName, start, end);
		if (lines != null)
			return lines;
		FileRange time = parseTime(fileName, start, end);
		if (time != null)
			return time;
		throw new ParseException("Unknown range: '" + range + "'", sep + 1);
	}

	private static FileRange parseLines(String fileName, String start, String end) {
		long startIdx, endIdx;
		if (START.equalsIgnoreCase(start))
			startIdx = 0;
		else {
			Long parsed = Longs.tryParse(stripHash(start));
			if (parsed == null)
				return null;
			startIdx = parsed;
		}
		if (END.equalsIgnoreCase(end))
			endIdx = FileRange.OPEN_END;
		else {
			Long parsed = Longs.tryParse(stripHash(end));
			if (parsed == null)
				return null;
			endIdx = parsed;
		}
		return FileRange.lines(fileName, startIdx, endIdx);
	}

	private static FileRange parseTime(String fileName, String start, String end) {
		long startTime, endTime;
		if (START.equalsIgnoreCase(start))
			startTime = 0;
		else {
			startTime = parseTimestamp(start);
			if (startTime < 0)
				return null;
		}
		if (END.equalsIgnoreCase(end))
			endTime = FileRange.OPEN_END;
		else {
			endTime = parseTimestamp(end);
			if (endTime < 0)
				return null;
		}
		return FileRange.time(fileName, startTime, endTime);
	}

	private static String stripHash(String bound) {
		return bound.startsWith("#") ? bound.substring(1) : bound;
	}

	/**
	 * @param text The timestamp text, formatted as <code>hh:mm:ss,mmm</code>
	 * @return The number of milliseconds represented by the timestamp, or -1 if the text is not a timestamp
	 */
	public static long parseTimestamp(String text) {
		Matcher match = TIMESTAMP.matcher(text);
		if (!match.matches())
			return -1;
		Long hours = Longs.tryParse(match.group(1));
		if (hours == null)
			return -1;
		try {
			long millis = Math.multiplyExact(hours, HOUR);
			millis = Math.addExact(millis, Long.parseLong(match.group(2)) * MINUTE);
			millis = Math.addExact(millis, Long.parseLong(match.group(3)) * SECOND);
			return Math.addExact(millis, Long.parseLong(match.group(4)));
		} catch (ArithmeticException e) {
			return -1;
		}
	}

	/**
	 * @param millis A non-negative number of milliseconds
	 * @return The timestamp text for the time, formatted as <code>hh:mm:ss,mmm</code>
	 */
	public static String formatTimestamp(long millis) {
		return String.format("%02d:%02d:%02d,%03d", millis / HOUR, millis % HOUR / MINUTE, millis % MINUTE / SECOND, millis % SECOND);
	}
}
