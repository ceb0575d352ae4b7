package io.forgedi.di.error;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;

/**
 * Tells why an entry cannot be turned into generated code.
 * <p>
 * A failure found below the root of an entry is reported as a chain: one
 * {@link Kind#NESTED_COMPILATION_FAILURE} frame for every nested definition that was
 * being compiled, ending with the frame that carries the concrete cause. Each frame keeps
 * the path of segments from the entry name to the node it was raised for.
 */
public final class CompilationException extends DIException {
	public enum Kind {
		OBJECT_NOT_COMPILABLE,
		ANONYMOUS_TYPE_NOT_COMPILABLE,
		CLASS_NOT_FOUND,
		CLASS_NOT_INSTANTIABLE,
		MEMBER_NOT_ACCESSIBLE,
		NESTED_COMPILATION_FAILURE
	}

	public static final String NESTED_DEFINITION = "<nested definition>";

	private final Kind kind;
	private final List<Object> path;
	private final String reason;

	private CompilationException(Kind kind, List<Object> path, String reason, @Nullable CompilationException cause) {
		super(reason, cause);
		this.kind = kind;
		this.path = unmodifiableList(new ArrayList<>(path));
		this.reason = reason;
	}

	public static CompilationException of(Kind kind, List<Object> path, String reason) {
		return new CompilationException(kind, path, reason, null);
	}

	public static CompilationException nested(List<Object> path, CompilationException cause) {
		return new CompilationException(Kind.NESTED_COMPILATION_FAILURE, path, "Error while compiling " + label(path), cause);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Returns the concrete kind at the end of the chain
	 */
	public Kind getRootKind() {
		return getInnermost().kind;
	}

	/**
	 * Returns the path of the node this frame was raised for
	 */
	public List<Object> getFramePath() {
		return path;
	}

	/**
	 * Returns the full path from the entry name to the definition that caused the failure
	 */
	public List<Object> getPath() {
		return getInnermost().path;
	}

	public String getReason() {
		return reason;
	}

	public String getEntryName() {
		return String.valueOf(path.get(0));
	}

	public CompilationException getInnermost() {
		CompilationException frame = this;
		while (frame.getCause() instanceof CompilationException) {
			frame = (CompilationException) frame.getCause();
		}
		return frame;
	}

	@Override
	public String getMessage() {
		if (kind != Kind.NESTED_COMPILATION_FAILURE) {
			return "Entry \"" + getEntryName() + "\" cannot be compiled: " + reason;
		}
		StringBuilder sb = new StringBuilder();
		CompilationException frame = this;
		while (frame.kind == Kind.NESTED_COMPILATION_FAILURE) {
			sb.append(frame.reason).append(". ");
			frame = (CompilationException) frame.getCause();
		}
		return sb.append(frame.reason).toString();
	}

	public String getDisplayPath() {
		return getPath().stream()
				.map(segment -> segment instanceof Integer ? "index " + segment : String.valueOf(segment))
				.collect(joining(" → "));
	}

	private static String label(List<Object> path) {
		return path.size() == 1 ? String.valueOf(path.get(0)) : NESTED_DEFINITION;
	}
}
