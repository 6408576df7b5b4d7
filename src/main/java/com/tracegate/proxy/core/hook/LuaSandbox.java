package com.tracegate.proxy.core.hook;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.luaj.vm2.Globals;
import org.luaj.vm2.LoadState;
import org.luaj.vm2.LuaError;
import org.luaj.vm2.LuaString;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;
import org.luaj.vm2.compiler.LuaC;
import org.luaj.vm2.lib.Bit32Lib;
import org.luaj.vm2.lib.DebugLib;
import org.luaj.vm2.lib.PackageLib;
import org.luaj.vm2.lib.StringLib;
import org.luaj.vm2.lib.TableLib;
import org.luaj.vm2.lib.VarArgFunction;
import org.luaj.vm2.lib.ZeroArgFunction;
import org.luaj.vm2.lib.jse.JseBaseLib;
import org.luaj.vm2.lib.jse.JseMathLib;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.exceptions.HookExecutionException;
import com.tracegate.proxy.core.http.HeaderMap;

/**
 * An isolated Lua environment for a single hook invocation.
 * <p>
 * Each instance owns fresh {@link Globals} with only the base, package, bit32,
 * table, string and math libraries. There is no {@code io}, {@code os},
 * {@code luajava} or {@code debug}, {@code dofile} and {@code loadfile} are
 * removed, and {@code require} only resolves preloaded modules such as
 * {@code json}. {@code print} goes to the application log.
 * </p>
 * <p>
 * LuaJ keeps the string metatable in a JVM-wide static. It is replaced once
 * with a protected metatable whose {@code __index} is a private copy of the
 * string library, so {@code getmetatable('')} only yields {@code "string"} and
 * string methods cannot be changed from a script.
 * </p>
 * <p>
 * With a positive timeout the VM checks a deadline every
 * {@value #INSTRUCTION_CHECK_INTERVAL} instructions. The abort is raised as an
 * {@link Error} so a script's own {@code pcall} cannot swallow it.
 * </p>
 * Instances are not thread-safe and are meant to be used once.
 */
public final class LuaSandbox implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LuaSandbox.class);

    /** VM instructions between deadline checks. */
    public static final int INSTRUCTION_CHECK_INTERVAL = 1000;

    static {
        LuaString.s_metatable = protectedStringMetatable();
    }

    private final Globals globals;
    private final long timeoutNanos;
    private long deadline;
    private boolean closed;

    /**
     * Creates a sandbox without a time budget.
     */
    public LuaSandbox() {
        this(0);
    }

    /**
     * @param timeoutMillis Budget for each {@link #execute} or {@link #call};
     *                      zero or negative disables it.
     */
    public LuaSandbox(long timeoutMillis) {
        this.timeoutNanos = timeoutMillis > 0 ? TimeUnit.MILLISECONDS.toNanos(timeoutMillis) : 0;
        this.globals = createGlobals();
        if (timeoutNanos > 0) {
            installDeadlineCheck();
        }
    }

    private static Globals createGlobals() {
        Globals g = new Globals();
        g.load(new JseBaseLib());
        g.load(new PackageLib());
        g.load(new Bit32Lib());
        g.load(new TableLib());
        g.load(new StringLib());
        g.load(new JseMathLib());
        LoadState.install(g);
        LuaC.install(g);

        g.set("dofile", LuaValue.NIL);
        g.set("loadfile", LuaValue.NIL);
        g.set("print", new LogPrint());

        LuaTable pkg = g.get("package").checktable();
        pkg.get("preload").set(LuaJsonLib.MODULE_NAME, new LuaJsonLib());
        // Keep only the preload searcher: no file system or Java class lookup
        LuaValue preloadSearcher = pkg.get("searchers").get(1);
        pkg.set("searchers", LuaValue.listOf(new LuaValue[] { preloadSearcher }));
        pkg.set("path", LuaValue.EMPTYSTRING);
        return g;
    }

    private static LuaTable protectedStringMetatable() {
        Globals g = new Globals();
        g.load(new StringLib());
        LuaTable meta = new LuaTable();
        meta.set(LuaValue.INDEX, g.get("string"));
        meta.set(LuaValue.METATABLE, LuaValue.valueOf("string"));
        return meta;
    }

    private void installDeadlineCheck() {
        globals.load(new DebugLib());
        LuaValue sethook = globals.get("debug").get("sethook");
        globals.set("debug", LuaValue.NIL);
        globals.get("package").get("loaded").set("debug", LuaValue.NIL);

        LuaValue check = new ZeroArgFunction() {
            @Override
            public LuaValue call() {
                if (deadline != 0 && System.nanoTime() - deadline > 0) {
                    throw new ScriptTimeoutError();
                }
                return NIL;
            }
        };
        sethook.invoke(LuaValue.varargsOf(new LuaValue[] { check, LuaValue.EMPTYSTRING,
                LuaValue.valueOf(INSTRUCTION_CHECK_INTERVAL) }));
    }

    /**
     * Compiles and runs a chunk, defining whatever globals it declares.
     * 
     * @param script    Lua source.
     * @param chunkName Name reported in error messages.
     * @throws HookExecutionException If compilation or execution fails.
     */
    public void execute(String script, String chunkName) {
        guard(() -> globals.load(script, chunkName).call());
    }

    /**
     * @return True if the global with this name is a function.
     */
    public boolean hasFunction(String name) {
        ensureOpen();
        return globals.get(name).isfunction();
    }

    /**
     * Calls a global hook function with {@code (body, headers)} and converts its
     * two results back.
     * 
     * @param function Global function name.
     * @param body     Body bytes, passed as a Lua byte string.
     * @param headers  Headers, passed as a table of value lists.
     * @return The body and headers the function returned.
     * @throws HookExecutionException If the call fails or returns anything other
     *                                than a string and a table.
     */
    public HookResult call(String function, byte[] body, HeaderMap headers) {
        LuaValue fn = guard(() -> globals.get(function));
        if (!fn.isfunction()) {
            throw new HookExecutionException("Global '" + function + "' is not a function");
        }
        LuaTable headerTable = LuaHeaders.toTable(headers);
        Varargs result = guard(() -> fn.invoke(LuaValue.varargsOf(LuaValue.valueOf(body), headerTable)));

        LuaValue newBody = result.arg(1);
        LuaValue newHeaders = result.arg(2);
        if (newBody.type() != LuaValue.TSTRING) {
            throw new HookExecutionException(function + " returned " + newBody.typename() + " as body, expected string");
        }
        if (!newHeaders.istable()) {
            throw new HookExecutionException(
                    function + " returned " + newHeaders.typename() + " as headers, expected table");
        }
        LuaString s = newBody.checkstring();
        byte[] bytes = new byte[s.length()];
        s.copyInto(0, bytes, 0, bytes.length);
        return new HookResult(bytes, LuaHeaders.fromTable(newHeaders.checktable()));
    }

    private <T> T guard(Supplier<T> action) {
        ensureOpen();
        deadline = timeoutNanos > 0 ? System.nanoTime() + timeoutNanos : 0;
        try {
            return action.get();
        } catch (ScriptTimeoutError e) {
            throw new HookExecutionException("Script exceeded its time budget of "
                    + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms");
        } catch (LuaError e) {
            throw new HookExecutionException(e.getMessage(), e);
        } catch (StackOverflowError e) {
            throw new HookExecutionException("Lua stack overflow");
        } catch (HookExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HookExecutionException("Script failed: " + e, e);
        } finally {
            deadline = 0;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Sandbox already closed");
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Thrown from the instruction hook once the deadline has passed.
     */
    static final class ScriptTimeoutError extends Error {
        private static final long serialVersionUID = 1L;

        ScriptTimeoutError() {
            super("Lua script time budget exceeded", null, false, false);
        }
    }

    /**
     * {@code print} replacement that writes to the application log.
     */
    private static final class LogPrint extends VarArgFunction {
        @Override
        public Varargs invoke(Varargs args) {
            StringBuilder sb = new StringBuilder();
            for (int i = 1; i <= args.narg(); i++) {
                if (i > 1) {
                    sb.append('\t');
                }
                sb.append(args.arg(i).tojstring());
            }
            log.info("[lua] {}", sb);
            return NONE;
        }
    }
}
