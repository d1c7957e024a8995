package org.subby.range;

import java.util.Objects;

/**
 * A subtitle file name, optionally restricted to a range of its lines or of its timeline. An {@link #OPEN_END open end} extends the range
 * to the end of the file.
 */
public final class FileRange {
	/** The end bound of a range that extends to the end of the file */
	public static final long OPEN_END = -1;

	/** What the bounds of a range measure */
	public enum RangeType {
		/** The whole file, no bounds */
		NONE,
		/** Subtitle line indexes */
		LINES,
		/** Milliseconds from the start of the timeline */
		TIME;
	}

	private final String theFileName;
	private final RangeType theType;
	private final long theStart;
	private final long theEnd;

	private FileRange(String fileName, RangeType type, long start, long end) {
		theFileName = Objects.requireNonNull(fileName, "File name must not be null");
		theType = type;
		theStart = start;
		theEnd = end;
	}

	/**
	 * @param fileName The name of the file
	 * @return A range covering the whole file
	 */
	public static FileRange whole(String fileName) {
		return new FileRange(fileName, RangeType.NONE, 0, OPEN_END);
	}

	/**
	 * @param fileName The name of the file
	 * @param start The first line index in the range
	 * @param end The line index after the range, or {@link #OPEN_END}
	 * @return The line range
	 */
	public static FileRange lines(String fileName, long start, long end) {
		return new FileRange(fileName, RangeType.LINES, start, end);
	}

	/**
	 * @param fileName The name of the file
	 * @param start The start of the range, in milliseconds
	 * @param end The end of the range in milliseconds, or {@link #OPEN_END}
	 * @return The time range
	 */
	public static FileRange time(String fileName, long start, long end) {
		return new FileRange(fileName, RangeType.TIME, start, end);
	}

	/** @return The name of the file */
	public String getFileName() {
		return theFileName;
	}

	/** @return What the bounds of this range measure */
	public RangeType getType() {
		return theType;
	}

	public long getStart() {
		return theStart;
	}

	public long getEnd() {
		return theEnd;
	}

	/** @return Whether this range extends to the end of the file */
	public boolean isOpenEnded() {
		return theEnd == OPEN_END;
	}

	/**
	 * @param index The index of a subtitle line
	 * @param startTime The start time of the line, in milliseconds
	 * @return Whether the line falls within this range
	 */
	public boolean contains(long index, long startTime) {
		long position;
		switch (theType) {
		case LINES:
			position = index;
			break;
		case TIME:
			position = startTime;
			break;
		default:
			return true;
		}
		return position >= theStart && (isOpenEnded() || position < theEnd);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theFileName, theType, theStart, theEnd);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof FileRange))
			return false;
		FileRange other = (FileRange) obj;
		return theFileName.equals(other.theFileName) && theType == other.theType && theStart == other.theStart && theEnd == other.theEnd;
	}

	@Override
	public String toString() {
		switch (theType) {
		case LINES:
			return theFileName + ":#" + theStart + "-" + (isOpenEnded() ? "end" : "#" + theEnd);
		case TIME:
			return theFileName + ":" + FileRangeParser.formatTimestamp(theStart) + "-"
				+ (isOpenEnded() ? "end" : FileRangeParser.formatTimestamp(theEnd));
		default:
			return theFileName;
		}
	}
}
