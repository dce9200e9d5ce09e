package alpha.lapis.route;

import alpha.lapis.Config;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;

import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A {@link RouteSource} backed by a directory in the file system.<p>
 *
 * Each subdirectory, recursively, is a route segment. Hidden directories
 * (names starting with '.') are skipped. A directory becomes a leaf if it
 * contains a regular file with the configured leaf file name, which by
 * default is {@value #DEFAULT_LEAF_FILE_NAME}.<p>
 *
 * The leaf file uses the {@link Properties} format, read as UTF-8. Each key
 * is an HTTP method token and each value the fully qualified name of a class
 * implementing {@link RequestHandler}, which must have a public no-arg
 * constructor:
 *
 * <pre>
 *   # api/users/[id]/route.properties
 *   GET    = com.example.users.GetUser
 *   DELETE = com.example.users.DeleteUser
 * </pre>
 *
 * The key "WEBSOCKET" instead names a class implementing {@link
 * WebSocketHandler}, which converses with clients that upgrade the
 * connection:
 *
 * <pre>
 *   # api/chat/route.properties
 *   GET       = com.example.chat.ChatPage
 *   WEBSOCKET = com.example.chat.ChatRoom
 * </pre>
 *
 * A key declared twice in the same file is not overwritten; both
 * declarations are returned and the compiler reports the duplicate.<p>
 *
 * One handler instance is created per declaration, using the class loader
 * given to the constructor.
 *
 * @see Config#leafFileName()
 */
public final class FileSystemRouteSource implements RouteSource
{
    private static final System.Logger LOG
            = System.getLogger(FileSystemRouteSource.class.getPackageName());

    /**
     * The default leaf file name.
     */
    public static final String DEFAULT_LEAF_FILE_NAME = "route.properties";

    private final Path root;
    private final String leafFileName;
    private final ClassLoader loader;

    /**
     * Constructs a {@code FileSystemRouteSource} using the default leaf file
     * name and the context class loader of the current thread.
     *
     * @param root directory
     */
    public FileSystemRouteSource(Path root) {
        this(root, DEFAULT_LEAF_FILE_NAME, Thread.currentThread().getContextClassLoader());
    }

    /**
     * Constructs a {@code FileSystemRouteSource}.
     *
     * @param root directory
     * @param leafFileName name of leaf files
     * @param loader used to load handler classes
     *
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code leafFileName} is empty
     */
    public FileSystemRouteSource(Path root, String leafFileName, ClassLoader loader) {
        this.root = requireNonNull(root);
        this.leafFileName = requireNonNull(leafFileName);
        this.loader = requireNonNull(loader);
        if (leafFileName.isEmpty()) {
            throw new IllegalArgumentException("Empty leaf file name.");
        }
    }

    /**
     * Constructs a {@code FileSystemRouteSource} using the leaf file name of
     * the given configuration and the context class loader of the current
     * thread.
     *
     * @param root directory
     * @param config of server
     * @return a new route source
     */
    public static FileSystemRouteSource of(Path root, Config config) {
        return new FileSystemRouteSource(root, config.leafFileName(),
                Thread.currentThread().getContextClassLoader());
    }

    @Override
    public List<String> listDirectories(List<String> directory) throws IOException {
        final Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith("."))
                    .sorted()
                    .collect(toList());
        }
    }

    @Override
    public Optional<List<HandlerDeclaration>> readLeaf(List<String> directory) throws IOException {
        final Path file = resolve(directory).resolve(leafFileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        LOG.log(DEBUG, () -> "Reading leaf file: " + file);
        RecordingProperties p = new RecordingProperties();
        try (Reader r = Files.newBufferedReader(file, UTF_8)) {
            p.load(r);
        }
        List<HandlerDeclaration> decl = new ArrayList<>();
        for (Map.Entry<String, String> e : p.entries) {
            final String key = e.getKey();
            decl.add(key.equals(HandlerDeclaration.WEBSOCKET) ?
                    HandlerDeclaration.webSocket(
                            instantiate(file, key, e.getValue(), WebSocketHandler.class)) :
                    new HandlerDeclaration(
                            key, instantiate(file, key, e.getValue(), RequestHandler.class)));
        }
        return Optional.of(List.copyOf(decl));
    }

    private Path resolve(List<String> directory) {
        Path p = root;
        for (String d : directory) {
            p = p.resolve(d);
        }
        return p;
    }

    private <T> T instantiate(Path file, String method, String className, Class<T> iface) {
        final String name = className.strip();
        final String ctx = "\"" + method + "\" in " + file;
        if (name.isEmpty()) {
            throw new HandlerBindingException("No handler class declared for " + ctx + ".");
        }
        final Class<?> type;
        try {
            type = Class.forName(name, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new HandlerBindingException(
                    "Failed to load handler class \"" + name + "\" for " + ctx + ".", e);
        }
        if (!iface.isAssignableFrom(type)) {
            throw new HandlerBindingException(
                    "Class \"" + name + "\" for " + ctx + " does not implement " +
                    iface.getName() + ".");
        }
        try {
            return iface.cast(type.getConstructor().newInstance());
        } catch (InvocationTargetException e) {
            throw new HandlerBindingException(
                    "Constructor of \"" + name + "\" for " + ctx + " failed.", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new HandlerBindingException(
                    "Failed to instantiate \"" + name + "\" for " + ctx +
                    "; a public no-arg constructor is required.", e);
        }
    }

    /**
     * Records every key-value pair as loaded, in file order, including
     * repeated keys.
     */
    private static final class RecordingProperties extends Properties {
        private static final long serialVersionUID = 1L;

        final transient List<Map.Entry<String, String>> entries = new ArrayList<>();

        @Override
        public synchronized Object put(Object key, Object value) {
            entries.add(Map.entry((String) key, (String) value));
            return super.put(key, value);
        }
    }

    @Override
    public String toString() {
        return FileSystemRouteSource.class.getSimpleName() + "{" +
                "root=" + root +
                ", leafFileName='" + leafFileName + '\'' + '}';
    }
}
