package exm.rdl.frontend;

import static exm.rdl.ast.ASTBuilder.body;
import static exm.rdl.ast.ASTBuilder.componentDef;
import static exm.rdl.ast.ASTBuilder.root;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.rdl.Elaborator;
import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.InstantiationCycleException;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.lang.ComponentKind;

public class SpecializationCacheTest {

  private GlobalContext globals;
  private ComponentTemplate x, y, z;
  private SpecializationCache cache;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SpecializationCacheTest.rdl.log", true);
  }

  @Before
  public void setup() throws UserException {
    Elaborator elab = new Elaborator("test.rdl", false, true, 1024);
    elab.loadDeclarations(root(componentDef("reg", "x", body()),
                               componentDef("reg", "y", body()),
                               componentDef("reg", "z", body())));
    globals = elab.getGlobals();
    x = globals.lookupTemplate("x");
    y = globals.lookupTemplate("y");
    z = globals.lookupTemplate("z");
    cache = new SpecializationCache();
  }

  private static SpecializedComponent component(String name) {
    return new SpecializedComponent.Builder(ComponentKind.REG, name,
                                    ParameterEnvironment.EMPTY).build();
  }

  /**
   * Builder that counts how many times it ran
   */
  private static Callable<SpecializedComponent> counting(
      final String name, final AtomicInteger count) {
    return new Callable<SpecializedComponent>() {
      @Override
      public SpecializedComponent call() {
        count.incrementAndGet();
        return component(name);
      }
    };
  }

  @Test
  public void testHitsAndMisses() throws UserException {
    AtomicInteger builds = new AtomicInteger();
    SpecializedComponent first = cache.get(globals, x,
                ParameterEnvironment.EMPTY, counting("x", builds));
    SpecializedComponent second = cache.get(globals, x,
                ParameterEnvironment.EMPTY, counting("x", builds));
    cache.get(globals, y, ParameterEnvironment.EMPTY, counting("y", builds));
    assertSame(first, second);
    assertEquals(2, builds.get());
    assertEquals(2, cache.misses());
    assertEquals(1, cache.hits());
    assertEquals(2, cache.size());
  }

  @Test
  public void testFailureIsCached() throws UserException {
    final AtomicInteger builds = new AtomicInteger();
    final UserException failure = new UserException("build failed");
    Callable<SpecializedComponent> failing =
        new Callable<SpecializedComponent>() {
          @Override
          public SpecializedComponent call() throws UserException {
            builds.incrementAndGet();
            throw failure;
          }
        };
    for (int i = 0; i < 2; i++) {
      try {
        cache.get(globals, x, ParameterEnvironment.EMPTY, failing);
        fail("Expected failure");
      } catch (UserException e) {
        assertSame(failure, e);
      }
    }
    assertEquals(1, builds.get());
  }

  @Test
  public void testCycleIsNotCached() throws UserException {
    final AtomicInteger builds = new AtomicInteger();
    Callable<SpecializedComponent> selfReferencing =
        new Callable<SpecializedComponent>() {
          @Override
          public SpecializedComponent call() throws UserException {
            builds.incrementAndGet();
            return cache.get(globals, x, ParameterEnvironment.EMPTY,
                             counting("x", new AtomicInteger()));
          }
        };
    for (int i = 0; i < 2; i++) {
      try {
        cache.get(globals, x, ParameterEnvironment.EMPTY, selfReferencing);
        fail("Expected cycle");
      } catch (InstantiationCycleException e) {
        // Expected
      }
    }
    assertEquals(2, builds.get());
    assertEquals(0, cache.size());

    SpecializedComponent ok = cache.get(globals, x,
        ParameterEnvironment.EMPTY, counting("x", new AtomicInteger()));
    assertEquals("x", ok.typeName());
  }

  @Test(expected=InstantiationCycleException.class)
  public void testReentrantBuild() throws UserException {
    cache.get(globals, x, ParameterEnvironment.EMPTY,
        new Callable<SpecializedComponent>() {
          @Override
          public SpecializedComponent call() throws UserException {
            return cache.get(globals, x, ParameterEnvironment.EMPTY,
                             counting("x", new AtomicInteger()));
          }
        });
  }

  /**
   * Two threads each building one template that needs the other must both
   * fail rather than deadlock
   */
  @Test(timeout=10000)
  public void testCrossThreadCycle() throws Exception {
    final CyclicBarrier bothBuilding = new CyclicBarrier(2);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<SpecializedComponent> fx = pool.submit(
          needs(x, y, bothBuilding));
      Future<SpecializedComponent> fy = pool.submit(
          needs(y, x, bothBuilding));
      assertCycle(fx);
      assertCycle(fy);
    } finally {
      pool.shutdownNow();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  private Callable<SpecializedComponent> needs(final ComponentTemplate self,
      final ComponentTemplate other, final CyclicBarrier barrier) {
    return new Callable<SpecializedComponent>() {
      @Override
      public SpecializedComponent call() throws Exception {
        return cache.get(globals, self, ParameterEnvironment.EMPTY,
            new Callable<SpecializedComponent>() {
              @Override
              public SpecializedComponent call() throws Exception {
                barrier.await();
                return cache.get(globals, other, ParameterEnvironment.EMPTY,
                                 counting(other.name(), new AtomicInteger()));
              }
            });
      }
    };
  }

  private static void assertCycle(Future<SpecializedComponent> f)
      throws InterruptedException {
    try {
      f.get();
      fail("Expected cycle");
    } catch (ExecutionException e) {
      assertTrue(e.getCause().toString(),
                 e.getCause() instanceof InstantiationCycleException);
    }
  }

  /**
   * x needs y, z needs y then x.  The thread building x blocks on y while
   * the other thread builds it; once y is finished, asking for x must wait
   * for x rather than report a cycle through the finished y.
   */
  @Test(timeout=30000)
  public void testSharedDependencyIsNotACycle() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      for (int i = 0; i < 20; i++) {
        cache = new SpecializationCache();
        final CountDownLatch yClaimed = new CountDownLatch(1);
        Future<SpecializedComponent> fx = pool.submit(
            new Callable<SpecializedComponent>() {
              @Override
              public SpecializedComponent call() throws Exception {
                return cache.get(globals, x, ParameterEnvironment.EMPTY,
                    new Callable<SpecializedComponent>() {
                      @Override
                      public SpecializedComponent call() throws Exception {
                        yClaimed.await();
                        cache.get(globals, y, ParameterEnvironment.EMPTY,
                                  counting("y", new AtomicInteger()));
                        return component("x");
                      }
                    });
              }
            });
        Future<SpecializedComponent> fz = pool.submit(
            new Callable<SpecializedComponent>() {
              @Override
              public SpecializedComponent call() throws Exception {
                return cache.get(globals, z, ParameterEnvironment.EMPTY,
                    new Callable<SpecializedComponent>() {
                      @Override
                      public SpecializedComponent call() throws Exception {
                        cache.get(globals, y, ParameterEnvironment.EMPTY,
                            new Callable<SpecializedComponent>() {
                              @Override
                              public SpecializedComponent call() {
                                yClaimed.countDown();
                                // Finish only once x's build asked for y
                                while (cache.hits() < 1) {
                                  Thread.yield();
                                }
                                return component("y");
                              }
                            });
                        cache.get(globals, x, ParameterEnvironment.EMPTY,
                                  counting("x", new AtomicInteger()));
                        return component("z");
                      }
                    });
              }
            });
        assertEquals("x", fx.get().typeName());
        assertEquals("z", fz.get().typeName());
        assertEquals(3, cache.misses());
      }
    } finally {
      pool.shutdownNow();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }
}
