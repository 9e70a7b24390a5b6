import org.junit.jupiter.api.Test;

import com.lambdacalc.debug.Debug;

import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the main classes in a fresh class loader so that Debug's static
 * initialisation runs here, untouched by any other test's setSink call.
 */
public class DebugStartupTest {

    private static URLClassLoader freshLoader() {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        return new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader());
    }

    @Test
    void freshDebug_startsWithTheNoopSink() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> debugClass = Class.forName("com.lambdacalc.debug.Debug", true, loader);
            assertNotSame(Debug.class, debugClass);

            Object debug = debugClass.getMethod("get").invoke(null);
            assertEquals(false, debugClass.getMethod("isEnabled").invoke(debug));
            assertNotNull(debugClass.getMethod("getSink").invoke(debug));
            debugClass.getMethod("d", String.class, String.class).invoke(debug, "startup", "no sink installed");
        }
    }

    @Test
    void freshEngine_reachesFixpointWithoutASink() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> engineClass = Class.forName("com.lambdacalc.LambdaEngine", true, loader);
            Object engine = engineClass.getConstructor().newInstance();
            Method evaluate = engineClass.getMethod("evaluate", String[].class);

            Object result = evaluate.invoke(engine, (Object) new String[] { "PLUS", "2", "2" });
            assertEquals(true, result.getClass().getMethod("converged").invoke(result));
            assertEquals("(\\f.(\\x.[f [f [f [f x]]]]))", result.getClass().getMethod("render").invoke(result));
        }
    }
}
