package ru.dimension.inject;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.dimension.inject.fixtures.Connection;
import ru.dimension.inject.fixtures.FakeConnection;
import ru.dimension.inject.fixtures.HashFunction;
import ru.dimension.inject.fixtures.Sha256Hash;

/**
 * End-to-end tests for wrapping operations with an {@link Injector}.
 */
class InjectorTest {

  private static final Key HASH_DEP = Key.of("hash");

  private DependencyMap deps;
  private AtomicInteger constructions;

  @BeforeEach
  void setUp() {
    deps = new DependencyMap();
    constructions = new AtomicInteger();
  }

  private Operation<String> rawHasher() {
    return Operation.of("hasher",
        Signature.builder().param("subject").param("hash", HASH_DEP).build(),
        args -> args.get("hash", HashFunction.class).hash(args.get("subject", String.class)));
  }

  private Operation<Object> echo(Object defaultKey) {
    return Operation.of("echo",
        Signature.builder().param("conn", defaultKey).build(),
        args -> args.get("conn"));
  }

  @Nested
  @DisplayName("Hashing scenario")
  class HashingScenario {

    @BeforeEach
    void registerHash() {
      deps.registerSingleton(HASH_DEP, () -> {
        constructions.incrementAndGet();
        return new Sha256Hash();
      });
    }

    @Test
    @DisplayName("The hash dependency is resolved once and used for the digest")
    void injectsSingleton() throws Exception {
      Operation<String> hasher = Injector.bind(deps).wrap(rawHasher());

      assertEquals(Sha256Hash.digest("foobarbaz"), hasher.call("foobarbaz"));
      assertEquals(Sha256Hash.digest("again"), hasher.call("again"));
      assertEquals(1, constructions.get());
    }

    @Test
    @DisplayName("An explicit keyword argument bypasses resolution")
    void keywordOverride() throws Exception {
      Operation<String> hasher = Injector.bind(deps).wrap(rawHasher());
      HashFunction custom = s -> "custom(" + s + ")";

      assertEquals("custom(x)", hasher.call(CallArgs.of("x").with("hash", custom)));
      assertEquals(0, constructions.get(), "Override must not construct the singleton");
    }

    @Test
    @DisplayName("An explicit positional argument in an injectable slot bypasses resolution")
    void positionalOverride() throws Exception {
      Operation<String> hasher = Injector.bind(deps).wrap(rawHasher());
      HashFunction custom = s -> "pos(" + s + ")";

      assertEquals("pos(x)", hasher.call("x", custom));
      assertEquals(0, constructions.get());
    }

    @Test
    @DisplayName("The wrapped operation keeps the original name and signature")
    void transparentSignature() {
      Operation<String> original = rawHasher();
      Operation<String> hasher = Injector.bind(deps).wrap(original);

      assertEquals(original.name(), hasher.name());
      assertEquals(original.signature(), hasher.signature());
      assertInstanceOf(InjectedOperation.class, hasher);
      assertEquals(Map.of("hash", HASH_DEP), ((InjectedOperation<String>) hasher).injectionPoints());
    }
  }

  @Nested
  @DisplayName("Override precedence")
  class OverrideTests {

    @Test
    @DisplayName("Overriding leaves the key's singleton state untouched")
    void overrideKeepsSingletonUnconstructed() throws Exception {
      Provider<Connection> provider = Provider.singleton(() -> new FakeConnection("db://A"));
      deps.register(Connection.class, provider);
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));
      Connection b = new FakeConnection("db://B");

      assertSame(b, op.call(CallArgs.keyword("conn", b)));
      assertFalse(((Provider.SingletonFactory<Connection>) provider).isConstructed());

      Object injected = op.call();
      assertEquals("db://A", ((Connection) injected).url());
      assertTrue(((Provider.SingletonFactory<Connection>) provider).isConstructed());
    }

    @Test
    @DisplayName("An explicit null is still an override")
    void nullOverride() throws Exception {
      deps.register(Connection.class, new FakeConnection("db://A"));
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));

      assertNull(op.call(CallArgs.keyword("conn", null)));
    }

    @Test
    @DisplayName("A missing dependency can be supplied by the caller")
    void overrideMissing() throws Exception {
      Operation<Object> op = Injector.bind(deps).wrap(echo(Key.of("missing")));

      assertEquals("given", op.call("given"));
    }
  }

  @Nested
  @DisplayName("Resolution against the live map")
  class LiveMapTests {

    @Test
    @DisplayName("Re-registering an instance is seen by the next call")
    void reRegistration() throws Exception {
      Connection a = new FakeConnection("db://A");
      Connection b = new FakeConnection("db://B");
      deps.register(Connection.class, a);
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));

      assertSame(a, op.call());

      deps.register(Connection.class, b);
      assertSame(b, op.call());
    }

    @Test
    @DisplayName("A factory dependency is constructed on every call")
    void factoryPerCall() throws Exception {
      deps.registerFactory(Connection.class, () -> new FakeConnection("db://" + constructions.incrementAndGet()));
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));

      assertNotSame(op.call(), op.call());
      assertEquals(2, constructions.get());
    }

    @Test
    @DisplayName("A key removed after wrapping fails the call with UnknownDependencyException")
    void removedKey() throws Exception {
      deps.register(Connection.class, new FakeConnection("db://A"));
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));
      op.call();

      deps.remove(Connection.class);

      UnknownDependencyException ex = assertThrows(UnknownDependencyException.class, op::call);
      assertEquals(TypeKey.of(Connection.class), ex.key());
    }

    @Test
    @DisplayName("An unregistered Key default fails the call rather than passing the key through")
    void unregisteredKey() {
      Operation<Object> op = Injector.bind(deps).wrap(echo(Key.of("nope")));

      assertThrows(UnknownDependencyException.class, op::call);
    }

    @Test
    @DisplayName("Concurrent calls share one singleton construction")
    void concurrentCalls() throws Exception {
      deps.registerSingleton(HASH_DEP, () -> {
        constructions.incrementAndGet();
        return new Sha256Hash();
      });
      Operation<String> hasher = Injector.bind(deps).wrap(rawHasher());

      int threads = 8;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      Set<String> digests = ConcurrentHashMap.newKeySet();
      try {
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
          futures.add(pool.submit(() -> {
            start.await();
            digests.add(hasher.call("same"));
            return null;
          }));
        }
        start.countDown();
        for (Future<?> f : futures) {
          f.get(5, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }

      assertEquals(Set.of(Sha256Hash.digest("same")), digests);
      assertEquals(1, constructions.get());
    }
  }

  @Nested
  @DisplayName("Wrap-time classification")
  class ClassificationTests {

    @Test
    @DisplayName("A class default not bound in the map stays an ordinary default")
    void unboundClassIsLiteral() throws Exception {
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));

      assertSame(Connection.class, op.call());
    }

    @Test
    @DisplayName("An explicit TypeKey default is injectable even when unbound at wrap time")
    void unboundTypeKeyIsInjectable() throws Exception {
      Operation<Object> op = Injector.bind(deps).wrap(echo(TypeKey.of(Connection.class)));

      UnknownDependencyException ex = assertThrows(UnknownDependencyException.class, op::call);
      assertEquals(TypeKey.of(Connection.class), ex.key());

      Connection late = new FakeConnection("db://late");
      deps.register(Connection.class, late);
      assertSame(late, op.call());
    }

    @Test
    @DisplayName("Classification happens once at wrap time")
    void classificationIsCached() throws Exception {
      Operation<Object> op = Injector.builder(deps).warnWhenUnneeded(false).build().wrap(echo(Connection.class));
      deps.register(Connection.class, new FakeConnection("db://late"));

      assertSame(Connection.class, op.call());
    }

    @Test
    @DisplayName("Literal defaults and required parameters are left to ordinary binding")
    void mixedParameters() throws Exception {
      deps.register(Key.of("greeting"), "Hello");
      Operation<String> op = Injector.bind(deps).wrap("greet",
          Signature.builder()
              .param("who")
              .param("punctuation", "!")
              .param("greeting", Key.of("greeting"))
              .build(),
          args -> args.get("greeting") + ", " + args.get("who") + args.get("punctuation"));

      assertEquals("Hello, Ann!", op.call("Ann"));
      assertEquals("Hello, Ann?", op.call("Ann", "?"));
      assertEquals("Hi, Bob.", op.call(CallArgs.of("Bob", ".").with("greeting", "Hi")));
      assertThrows(IllegalArgumentException.class, op::call);
    }

    @Test
    @DisplayName("An operation without injection points is returned unchanged")
    void nothingToInject() throws Exception {
      Operation<Integer> identity = Operation.of("identity",
          Signature.builder().param("x").build(),
          args -> (Integer) args.get("x"));

      Operation<Integer> wrapped = Injector.builder(deps).warnWhenUnneeded(false).build().wrap(identity);

      assertSame(identity, wrapped);
      assertEquals(10, wrapped.call(10));
    }

    @Test
    @DisplayName("Binding a literal mapping behaves like a map of instances")
    void literalMapping() throws Exception {
      Connection conn = new FakeConnection("db://lit");
      Injector inject = Injector.bind(Map.of(Connection.class, conn, "foo", "FOO"));

      assertSame(conn, inject.wrap(echo(Connection.class)).call());
      assertEquals("FOO", inject.wrap(echo(Key.of("foo"))).call());
      assertEquals("FOO", inject.dependencies().resolve("foo"));
    }

    @Test
    @DisplayName("Composite keys resolve from the map")
    void compositeKey() throws Exception {
      deps.register(Key.of(Map.class, "foo"), "MAP-FOO");

      assertEquals("MAP-FOO", Injector.bind(deps).wrap(echo(Key.of(Map.class, "foo"))).call());
    }
  }

  @Nested
  @DisplayName("Error propagation")
  class ErrorTests {

    @Test
    @DisplayName("Checked exceptions from the delegate propagate unchanged")
    void checkedExceptionPropagates() {
      IOException failure = new IOException("disk on fire");
      deps.register(Connection.class, new FakeConnection("db://A"));
      Operation<Object> op = Injector.bind(deps).wrap("fail",
          Signature.builder().param("conn", Connection.class).build(),
          args -> {
            throw failure;
          });

      IOException thrown = assertThrows(IOException.class, op::call);
      assertSame(failure, thrown);
    }

    @Test
    @DisplayName("Constructor failures surface to the caller of the wrapped operation")
    void constructionFailurePropagates() {
      IllegalStateException failure = new IllegalStateException("cannot connect");
      deps.registerSingleton(Connection.class, () -> {
        throw failure;
      });
      Operation<Object> op = Injector.bind(deps).wrap(echo(Connection.class));

      assertSame(failure, assertThrows(IllegalStateException.class, op::call));
    }

    @Test
    @DisplayName("Call-site mistakes fail like ordinary argument binding")
    void bindingErrors() {
      deps.registerSingleton(HASH_DEP, Sha256Hash::new);
      Operation<String> hasher = Injector.bind(deps).wrap(rawHasher());

      assertThrows(IllegalArgumentException.class, () -> hasher.call("a", new Sha256Hash(), "extra"));
      assertThrows(IllegalArgumentException.class, () -> hasher.call(CallArgs.of("a").with("unknown", 1)));
      assertThrows(IllegalArgumentException.class, () -> hasher.call(CallArgs.of("a").with("subject", "b")));
    }
  }
}
