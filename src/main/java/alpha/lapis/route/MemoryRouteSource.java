package alpha.lapis.route;

import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A {@link RouteSource} backed by a virtual directory tree held in
 * memory.<p>
 *
 * The tree is described with a builder, using '/' separated directory paths
 * that follow the same naming conventions as real directories:
 *
 * <pre>{@code
 *   RouteSource src = MemoryRouteSource.builder()
 *           .handler("/", "GET", index)
 *           .handler("/users/[id]", "GET", getUser)
 *           .handler("/users/[id]", "DELETE", deleteUser)
 *           .handler("/files/[...path]", "GET", serveFile)
 *           .webSocket("/chat", chatRoom)
 *           .build();
 * }</pre>
 *
 * Declaring a handler creates the leaf and any missing directories on the
 * way. The builder does not validate anything; the same method may be
 * declared twice, which the {@link RouteCompiler} then rejects.<p>
 *
 * Instances are immutable.
 */
public final class MemoryRouteSource implements RouteSource
{
    /**
     * Returns a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    private final Map<List<String>, Directory> dirs;

    private MemoryRouteSource(Map<List<String>, Directory> dirs) {
        this.dirs = dirs;
    }

    @Override
    public List<String> listDirectories(List<String> directory) {
        Directory d = dirs.get(directory);
        return d == null ? List.of() : d.children;
    }

    @Override
    public Optional<List<HandlerDeclaration>> readLeaf(List<String> directory) {
        Directory d = dirs.get(directory);
        return d == null ? Optional.empty() : Optional.ofNullable(d.leaf);
    }

    @Override
    public String toString() {
        long leaves = dirs.values().stream().filter(d -> d.leaf != null).count();
        return MemoryRouteSource.class.getSimpleName() + "{" +
                "directories=" + dirs.size() +
                ", leaves=" + leaves + '}';
    }

    private static final class Directory {
        final List<String> children;
        final List<HandlerDeclaration> leaf;

        Directory(List<String> children, List<HandlerDeclaration> leaf) {
            this.children = children;
            this.leaf = leaf;
        }
    }

    /**
     * Builder of a {@link MemoryRouteSource}.<p>
     *
     * The builder is not thread-safe.
     */
    public static final class Builder
    {
        private final Map<List<String>, TreeSet<String>> children = new HashMap<>();
        private final Map<List<String>, List<HandlerDeclaration>> leaves = new HashMap<>();

        private Builder() {
            children.put(List.of(), new TreeSet<>());
        }

        /**
         * Add a directory, and any missing parent directories.
         *
         * @param path of directory, e.g. "/users/[id]"
         * @return this (for chaining)
         */
        public Builder directory(String path) {
            mkdirs(split(path));
            return this;
        }

        /**
         * Add a leaf with no declarations to a directory.
         *
         * @param path of directory
         * @return this (for chaining)
         */
        public Builder leaf(String path) {
            List<String> d = split(path);
            mkdirs(d);
            leaves.computeIfAbsent(d, k -> new ArrayList<>());
            return this;
        }

        /**
         * Declare a handler in the leaf of a directory.
         *
         * @param path of directory
         * @param method token
         * @param handler the handler
         * @return this (for chaining)
         * @throws NullPointerException if any argument is {@code null}
         */
        public Builder handler(String path, String method, RequestHandler handler) {
            HandlerDeclaration decl = new HandlerDeclaration(method, handler);
            List<String> d = split(path);
            mkdirs(d);
            leaves.computeIfAbsent(d, k -> new ArrayList<>()).add(decl);
            return this;
        }

        /**
         * Declare a WebSocket handler in the leaf of a directory.
         *
         * @param path of directory
         * @param handler the handler
         * @return this (for chaining)
         * @throws NullPointerException if any argument is {@code null}
         */
        public Builder webSocket(String path, WebSocketHandler handler) {
            HandlerDeclaration decl = HandlerDeclaration.webSocket(handler);
            List<String> d = split(path);
            mkdirs(d);
            leaves.computeIfAbsent(d, k -> new ArrayList<>()).add(decl);
            return this;
        }

        /**
         * Build the route source.
         *
         * @return the route source
         */
        public MemoryRouteSource build() {
            Map<List<String>, Directory> dirs = new HashMap<>();
            children.forEach((dir, kids) -> {
                List<HandlerDeclaration> leaf = leaves.get(dir);
                dirs.put(dir, new Directory(
                        List.copyOf(kids),
                        leaf == null ? null : List.copyOf(leaf)));
            });
            return new MemoryRouteSource(Map.copyOf(dirs));
        }

        private void mkdirs(List<String> dir) {
            for (int i = 1; i <= dir.size(); ++i) {
                List<String> parent = dir.subList(0, i - 1),
                             self   = dir.subList(0, i);
                children.computeIfAbsent(List.copyOf(parent), k -> new TreeSet<>())
                        .add(dir.get(i - 1));
                children.computeIfAbsent(List.copyOf(self), k -> new TreeSet<>());
            }
        }

        private static List<String> split(String path) {
            return Arrays.stream(requireNonNull(path).split("/"))
                         .filter(s -> !s.isEmpty())
                         .collect(toList());
        }
    }
}
