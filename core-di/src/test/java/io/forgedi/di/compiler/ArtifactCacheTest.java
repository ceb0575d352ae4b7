package io.forgedi.di.compiler;

import io.forgedi.di.CompiledContainer;
import io.forgedi.di.definition.DefinitionMap;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.error.DIException;
import io.forgedi.di.error.InvalidArtifactNameException;
import io.forgedi.di.fixture.Fixtures.CustomParentContainer;
import io.forgedi.di.introspect.ReflectionTypeIntrospector;
import io.forgedi.di.introspect.TypeIntrospector;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static java.util.stream.Collectors.toList;
import static org.junit.Assert.*;

public final class ArtifactCacheTest {
	@Rule
	public final TemporaryFolder tmpFolder = new TemporaryFolder();

	private Path directory;
	private ArtifactCache cache;

	@Before
	public void setUp() throws IOException {
		directory = tmpFolder.newFolder("artifacts").toPath();
		cache = ArtifactCache.create().withSyncWrites(false);
	}

	@Test
	public void buildsOnlyWhenArtifactIsMissing() {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "CachedContainer");
		AtomicInteger builds = new AtomicInteger();

		Path first = cache.obtainArtifact(identity, () -> {
			builds.incrementAndGet();
			return bytecode(identity, singletonMap("foo", "bar"));
		});
		Path second = cache.obtainArtifact(identity, () -> {
			throw new AssertionError("Existing artifact must not be rebuilt");
		});

		assertEquals(1, builds.get());
		assertEquals(first, second);
		assertEquals(identity.getArtifactPath(), first);
		assertEquals(1, listFiles(directory).size());
	}

	@Test
	public void existingFileIsReturnedUntouched() throws IOException {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "Existing");
		byte[] content = {1, 2, 3};
		Files.write(identity.getArtifactPath(), content);

		cache.obtainArtifact(identity, () -> {
			throw new AssertionError("Existing artifact must not be rebuilt");
		});

		assertArrayEquals(content, Files.readAllBytes(identity.getArtifactPath()));
	}

	@Test
	public void missingDirectoriesAreCreated() {
		ArtifactIdentity identity = ArtifactIdentity.of(directory.resolve("a").resolve("b"), "Nested");

		Path artifact = cache.obtainArtifact(identity, () -> bytecode(identity, singletonMap("foo", 1)));

		assertTrue(Files.isRegularFile(artifact));
	}

	@Test
	public void invalidNamesAreRejectedBeforeBuilding() {
		for (String className : new String[]{"123-abc", "", "class", "a..b", "with space", "java.foo.Gen"}) {
			ArtifactIdentity identity = ArtifactIdentity.of(directory, className);
			try {
				cache.obtainArtifact(identity, () -> {
					throw new AssertionError("Nothing must be built for an invalid name");
				});
				fail(className);
			} catch (InvalidArtifactNameException e) {
				assertEquals(className, e.getClassName());
			}
		}
		assertEquals(0, listFiles(directory).size());
	}

	@Test
	public void failedBuildLeavesNoFile() {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "Failing");

		try {
			cache.obtainArtifact(identity, () -> {
				throw new IllegalStateException("build failed");
			});
			fail();
		} catch (IllegalStateException e) {
			assertEquals("build failed", e.getMessage());
		}

		assertEquals(0, listFiles(directory).size());
	}

	@Test
	public void loadedClassIsDefinedOnce() {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "Loaded");
		cache.obtainArtifact(identity, () -> bytecode(identity, singletonMap("foo", "bar")));

		Class<? extends CompiledContainer> first = cache.loadArtifact(identity);
		Class<? extends CompiledContainer> second = cache.loadArtifact(identity);

		assertSame(first, second);
		assertEquals("Loaded", first.getName());
	}

	@Test
	public void artifactOfAnotherParentIsRejected() {
		ArtifactIdentity plain = ArtifactIdentity.of(directory, "Plain");
		cache.obtainArtifact(plain, () -> bytecode(plain, singletonMap("foo", "bar")));

		try {
			cache.loadArtifact(ArtifactIdentity.of(directory, "Plain", CustomParentContainer.class));
			fail();
		} catch (DIException e) {
			assertTrue(e.getMessage().contains("does not extend"));
		}
	}

	@Test
	public void corruptedArtifactIsReported() throws IOException {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "Corrupted");
		Files.write(identity.getArtifactPath(), new byte[]{0, 1, 2});

		try {
			cache.loadArtifact(identity);
			fail();
		} catch (DIException e) {
			assertTrue(e.getCause() instanceof LinkageError);
		}
	}

	@Test
	public void finalParentTypeIsRejected() {
		try {
			ArtifactIdentity.of(directory, "Any", FinalContainer.class);
			fail();
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains(FinalContainer.class.getName()));
		}
	}

	public static final class FinalContainer extends CompiledContainer {
		public FinalContainer() {
			super(DefinitionMap.of(singletonMap("foo", "bar")), new ReflectionTypeIntrospector());
		}

		@Override
		public String[] getCompiledEntries() {
			return new String[0];
		}
	}

	@Test
	public void writerWhichLosesTheRaceLeavesOneArtifact() throws Exception {
		ArtifactIdentity identity = ArtifactIdentity.of(directory, "Raced");
		ArtifactCache other = ArtifactCache.create().withSyncWrites(false);

		cache.obtainArtifact(identity, () -> {
			other.obtainArtifact(identity, () -> bytecode(identity, singletonMap("foo", "first")));
			assertTrue(Files.exists(identity.getArtifactPath()));
			return bytecode(identity, singletonMap("foo", "second"));
		});

		assertEquals(singletonList(identity.getArtifactPath()), listFiles(directory));
		Object fromCache = instantiate(cache.loadArtifact(identity)).get("foo");
		Object fromOther = instantiate(other.loadArtifact(identity)).get("foo");
		assertTrue(fromCache.equals("first") || fromCache.equals("second"));
		assertEquals(fromCache, fromOther);
	}

	@Test
	public void concurrentBuildersShareArtifacts() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			for (int i = 0; i < 10; i++) {
				ArtifactIdentity identity = ArtifactIdentity.of(directory, "Concurrent" + i);
				CountDownLatch start = new CountDownLatch(1);
				List<Future<Object>> results = new ArrayList<>();
				for (int j = 0; j < 2; j++) {
					ArtifactCache handle = ArtifactCache.create().withSyncWrites(false);
					results.add(executor.submit(() -> {
						start.await();
						handle.obtainArtifact(identity, () -> bytecode(identity, singletonMap("foo", "bar")));
						return instantiate(handle.loadArtifact(identity)).get("foo");
					}));
				}
				start.countDown();
				for (Future<Object> result : results) {
					assertEquals("bar", result.get(10, TimeUnit.SECONDS));
				}
			}
		} finally {
			executor.shutdownNow();
		}

		List<Path> files = listFiles(directory);
		assertEquals(10, files.size());
		for (Path file : files) {
			assertTrue(file.getFileName().toString().endsWith(ArtifactIdentity.ARTIFACT_EXTENSION));
		}
	}

	private static CompiledContainer instantiate(Class<? extends CompiledContainer> containerClass) throws ReflectiveOperationException {
		return containerClass.getConstructor(DefinitionSource.class, TypeIntrospector.class)
				.newInstance(DefinitionMap.of(emptyMap()), new ReflectionTypeIntrospector());
	}

	private static byte[] bytecode(ArtifactIdentity identity, Map<String, ?> definitions) {
		ContainerCompiler compiler = new ContainerCompiler(ArtifactCache.create(), new ReflectionTypeIntrospector());
		return new CodeGenerator().assemble(compiler.analyzeAll(DefinitionMap.of(definitions), emptyList()), identity);
	}

	private static List<Path> listFiles(Path dir) {
		try (Stream<Path> files = Files.list(dir)) {
			return files.collect(toList());
		} catch (IOException e) {
			throw new AssertionError(e);
		}
	}
}
