package com.gentoro.graphdsl.functions;

import com.gentoro.graphdsl.exception.ConfigException;
import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.logging.LoggingService;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;

/**
 * Registry of named functions that DSL expressions can call.
 *
 * <p>The typical lifecycle is:
 *
 * <ol>
 *   <li>Create a registry, either empty or pre-loaded with discovered {@link FunctionLibrary}
 *       implementations via {@link #withLibraries(Collection)}.
 *   <li>Register any host-specific functions.
 *   <li>Pass the registry to the stanza executor; it is only read during a run.
 * </ol>
 */
public class FunctionRegistry {
  private static final Logger log = LoggingService.getLogger(FunctionRegistry.class);

  /** Backing map of function name to implementation. */
  private final Map<String, GraphFunction> functions = new HashMap<>();

  /**
   * Create a registry holding the functions of the given libraries, discovered through {@link
   * ServiceLoader}. An empty or {@code null} collection loads every discovered library.
   *
   * @throws ConfigException if a requested library id is not available
   */
  public static FunctionRegistry withLibraries(Collection<String> libraryIds) {
    Map<String, FunctionLibrary> available = new LinkedHashMap<>();
    for (FunctionLibrary library : ServiceLoader.load(FunctionLibrary.class)) {
      available.putIfAbsent(library.id(), library);
    }
    FunctionRegistry registry = new FunctionRegistry();
    Collection<String> wanted =
        libraryIds == null || libraryIds.isEmpty() ? available.keySet() : libraryIds;
    for (String id : wanted) {
      FunctionLibrary library = available.get(id);
      if (library == null) {
        throw new ConfigException(
            "Unknown function library '" + id + "'; available: " + available.keySet());
      }
      library.registerAll(registry);
      log.debug("Loaded function library '{}'", id);
    }
    return registry;
  }

  /**
   * Register a function, replacing any previous function with the same name.
   *
   * @return this registry for fluent usage.
   */
  public FunctionRegistry register(String name, GraphFunction function) {
    functions.put(name, function);
    return this;
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  /** Registered function names in lexicographic order. */
  public Set<String> names() {
    return new TreeSet<>(functions.keySet());
  }

  /**
   * Invoke a registered function.
   *
   * @throws ExecutionException with {@link ExecutionError#UNKNOWN_FUNCTION} if no function has the
   *     name, or {@link ExecutionError#FUNCTION_ERROR} wrapping whatever the implementation threw
   */
  public Value invoke(String name, FunctionContext context, List<Value> arguments) {
    GraphFunction function = functions.get(name);
    if (function == null) {
      throw new ExecutionException(
          ExecutionError.UNKNOWN_FUNCTION, "No function registered with name '" + name + "'");
    }
    try {
      Value result = function.call(context, arguments);
      return result == null ? Value.NULL : result;
    } catch (Exception e) {
      String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      throw new ExecutionException(
          ExecutionError.FUNCTION_ERROR, "Function '" + name + "' failed: " + detail, e);
    }
  }
}
