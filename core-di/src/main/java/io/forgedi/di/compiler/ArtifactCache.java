package io.forgedi.di.compiler;

import io.forgedi.codegen.DefiningClassLoader;
import io.forgedi.common.ApplicationSettings;
import io.forgedi.di.CompiledContainer;
import io.forgedi.di.error.DIException;
import io.forgedi.di.error.InvalidArtifactNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Persists generated containers and loads them back.
 * <p>
 * The existence of the artifact file is the only thing checked: once written, an artifact
 * is loaded as is whatever definitions are given later. A new artifact is written to a temporary
 * file of the same directory and moved into place atomically, so concurrent builders never see
 * a partially written file. Builders racing on the same identity produce equivalent content,
 * each of them loads whichever complete file ends up in place.
 */
public final class ArtifactCache {
	private static final Logger logger = LoggerFactory.getLogger(ArtifactCache.class);

	public static final boolean SYNC_WRITES = ApplicationSettings.getBoolean(ArtifactCache.class, "syncWrites", true);

	private final Map<Path, Class<? extends CompiledContainer>> loadedClasses = new HashMap<>();
	private boolean syncWrites = SYNC_WRITES;

	private ArtifactCache() {
	}

	public static ArtifactCache create() {
		return new ArtifactCache();
	}

	/**
	 * Sets whether a new artifact is forced to disk before it is moved into place
	 */
	public ArtifactCache withSyncWrites(boolean syncWrites) {
		this.syncWrites = syncWrites;
		return this;
	}

	/**
	 * Tells whether a class can be defined under this name: a qualified Java name outside the {@code java} packages
	 */
	public static boolean isValidClassName(String className) {
		return SourceVersion.isName(className) && !className.startsWith("java.");
	}

	/**
	 * Returns the path of the artifact, calling {@code build} for its content only if it does not exist yet
	 *
	 * @throws InvalidArtifactNameException if the class name is not a valid Java class name,
	 *                                      before {@code build} is called or any file is touched
	 */
	public synchronized Path obtainArtifact(ArtifactIdentity identity, Supplier<byte[]> build) {
		if (!isValidClassName(identity.getClassName())) {
			throw new InvalidArtifactNameException(identity.getClassName());
		}
		Path artifactPath = identity.getArtifactPath();
		if (Files.exists(artifactPath)) {
			logger.debug("Reusing existing artifact {}", artifactPath);
			return artifactPath;
		}

		byte[] content = build.get();

		try {
			Files.createDirectories(identity.getDirectory());
			Path tempFile = Files.createTempFile(identity.getDirectory(), "." + identity.getClassName(), ".tmp");
			try {
				write(tempFile, content);
				moveIntoPlace(tempFile, artifactPath);
			} finally {
				Files.deleteIfExists(tempFile);
			}
		} catch (IOException e) {
			throw new DIException("Could not write artifact " + artifactPath, e);
		}
		return artifactPath;
	}

	/**
	 * Defines the class persisted for {@code identity}, once per cache
	 */
	public synchronized Class<? extends CompiledContainer> loadArtifact(ArtifactIdentity identity) {
		Path artifactPath = identity.getArtifactPath();
		Class<? extends CompiledContainer> loaded = loadedClasses.get(artifactPath);
		if (loaded == null) {
			loaded = defineArtifact(identity, artifactPath);
			loadedClasses.put(artifactPath, loaded);
		}
		if (!identity.getParentType().isAssignableFrom(loaded)) {
			throw new DIException("Artifact " + artifactPath + " does not extend " + identity.getParentType().getName() +
					", it was compiled for another parent type");
		}
		return loaded;
	}

	private Class<? extends CompiledContainer> defineArtifact(ArtifactIdentity identity, Path artifactPath) {
		byte[] bytecode;
		try {
			bytecode = Files.readAllBytes(artifactPath);
		} catch (IOException e) {
			throw new DIException("Could not read artifact " + artifactPath, e);
		}
		DefiningClassLoader classLoader = DefiningClassLoader.create(identity.getParentType().getClassLoader());
		Class<?> definedClass;
		try {
			definedClass = classLoader.defineClass(identity.getClassName(), bytecode);
		} catch (LinkageError e) {
			throw new DIException("Artifact " + artifactPath + " is not a valid class " + identity.getClassName(), e);
		}
		if (!CompiledContainer.class.isAssignableFrom(definedClass)) {
			throw new DIException("Artifact " + artifactPath + " is not a compiled container");
		}
		logger.trace("Defined {} from {}", definedClass.getName(), artifactPath);
		return definedClass.asSubclass(CompiledContainer.class);
	}

	private void write(Path file, byte[] content) throws IOException {
		try (FileChannel channel = FileChannel.open(file, WRITE)) {
			ByteBuffer buffer = ByteBuffer.wrap(content);
			while (buffer.hasRemaining()) {
				channel.write(buffer);
			}
			if (syncWrites) {
				channel.force(true);
			}
		}
	}

	private static void moveIntoPlace(Path tempFile, Path artifactPath) throws IOException {
		try {
			Files.move(tempFile, artifactPath, StandardCopyOption.ATOMIC_MOVE);
			logger.info("Artifact written to {}", artifactPath);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move is not supported for {}, moving without it", artifactPath);
			try {
				Files.move(tempFile, artifactPath);
				logger.info("Artifact written to {}", artifactPath);
			} catch (FileAlreadyExistsException ignored) {
				logger.debug("Artifact {} was written concurrently, keeping it", artifactPath);
			}
		} catch (FileAlreadyExistsException e) {
			logger.debug("Artifact {} was written concurrently, keeping it", artifactPath);
		}
	}
}
