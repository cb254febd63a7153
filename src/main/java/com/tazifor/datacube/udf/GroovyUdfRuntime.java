package com.tazifor.datacube.udf;

import com.tazifor.datacube.error.DatacubeException;
import com.tazifor.datacube.error.UdfContractViolationException;
import com.tazifor.datacube.error.UdfExecutionException;
import com.tazifor.datacube.error.UdfSyntaxException;
import com.tazifor.datacube.model.DataArray;
import groovy.lang.Binding;
import groovy.lang.GroovyClassLoader;
import groovy.lang.Script;
import lombok.extern.slf4j.Slf4j;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.runtime.InvokerHelper;
import org.codehaus.groovy.runtime.InvokerInvocationException;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs user functions written in Groovy.
 * <p>
 * Two shapes are accepted:
 * <pre>
 * // function style: receives the single input array
 * def apply_datacube(cube, context) {
 *     cube.multiply(2)
 * }
 *
 * // script style: rewrites the bound envelope
 * data.datacubes = data.datacubes.collect { it.add(1) }
 * </pre>
 * Function style may return an array, a list of arrays or an envelope.
 * </p>
 */
@Slf4j
public class GroovyUdfRuntime implements UdfRuntime {

    static final String ENTRY_POINT = "apply_datacube";

    private final AtomicLong counter = new AtomicLong();
    private final ClassLoader parent;

    public GroovyUdfRuntime() {
        this(GroovyUdfRuntime.class.getClassLoader());
    }

    public GroovyUdfRuntime(ClassLoader parent) {
        this.parent = parent;
    }

    /**
     * Parses {@code code} in a class loader of its own. The loader, and the
     * classes it defines, are only reachable from the returned udf.
     */
    @Override
    public CompiledUdf compile(String code) {
        GroovyClassLoader loader = new GroovyClassLoader(parent);
        Class<?> parsed;
        try {
            parsed = loader.parseClass(code, "udf_" + counter.incrementAndGet() + ".groovy");
        } catch (CompilationFailedException e) {
            throw new UdfSyntaxException("udf does not compile: " + e.getMessage(), e);
        }
        if (!Script.class.isAssignableFrom(parsed))
            throw new UdfSyntaxException("udf must be a script or define " + ENTRY_POINT + ", found class "
                + parsed.getName(), null);

        Class<? extends Script> scriptClass = parsed.asSubclass(Script.class);
        boolean functionStyle = false;
        for (Method m : scriptClass.getDeclaredMethods()) {
            if (m.getName().equals(ENTRY_POINT) && m.getParameterCount() == 2) {
                functionStyle = true;
                break;
            }
        }
        log.debug("compiled udf {} ({} style)", scriptClass.getName(), functionStyle ? "function" : "script");
        return new GroovyUdf(scriptClass, functionStyle);
    }

    @Override
    public String name() {
        return "groovy";
    }

    private record GroovyUdf(Class<? extends Script> scriptClass, boolean functionStyle) implements CompiledUdf {

        @Override
        public List<DataArray> run(UdfData data) {
            Binding binding = new Binding();
            binding.setVariable("data", data);
            binding.setVariable("context", data.getUserContext());
            Object result;
            try {
                Script script = InvokerHelper.createScript(scriptClass, binding);
                if (functionStyle) {
                    DataArray cube = data.getDatacubes().isEmpty() ? null : data.getDatacubes().get(0);
                    result = script.invokeMethod(ENTRY_POINT, new Object[]{cube, data.getUserContext()});
                } else {
                    script.run();
                    result = data.getDatacubes();
                }
            } catch (DatacubeException e) {
                throw e;
            } catch (Exception e) {
                Throwable cause = e;
                while (cause instanceof InvokerInvocationException && cause.getCause() != null) cause = cause.getCause();
                if (cause instanceof DatacubeException) throw (DatacubeException) cause;
                String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
                throw new UdfExecutionException(message, cause);
            }
            return arrays(result);
        }

        private static List<DataArray> arrays(Object result) {
            if (result == null) return List.of();
            if (result instanceof DataArray) return List.of((DataArray) result);
            if (result instanceof UdfData) return arrays(((UdfData) result).getDatacubes());
            if (result instanceof List) {
                List<DataArray> out = new ArrayList<>();
                for (Object o : (List<?>) result) {
                    if (!(o instanceof DataArray))
                        throw new UdfContractViolationException("udf returned a list element of type "
                            + (o == null ? "null" : o.getClass().getName()) + ", expected an array");
                    out.add((DataArray) o);
                }
                return out;
            }
            throw new UdfContractViolationException("udf returned " + result.getClass().getName()
                + ", expected an array, a list of arrays or an envelope");
        }
    }
}
