package alpha.lapis.route;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * A hierarchy of directories from which the {@link RouteCompiler} builds a
 * {@link RouteTree}.<p>
 *
 * A directory is identified by its names from the root; the root directory
 * is the empty list. A directory may contain a leaf, which declares the
 * handlers bound to the route that the directory represents.<p>
 *
 * The route source is only read during compilation.
 *
 * @see MemoryRouteSource
 * @see FileSystemRouteSource
 */
public interface RouteSource
{
    /**
     * List the names of all subdirectories of a directory.<p>
     *
     * The order of the returned names is not significant; the compiler sorts
     * them.
     *
     * @param directory names from the root
     * @return subdirectory names (never {@code null})
     * @throws IOException if an I/O error occurs
     */
    List<String> listDirectories(List<String> directory) throws IOException;

    /**
     * Read the handler declarations of the leaf in a directory.<p>
     *
     * An empty optional is returned if the directory has no leaf. A present
     * but empty list means the directory has a leaf with no declarations.
     *
     * @param directory names from the root
     * @return declarations in declaration order, or empty if there's no leaf
     * @throws IOException if an I/O error occurs
     * @throws HandlerBindingException if a declared handler can not be created
     */
    Optional<List<HandlerDeclaration>> readLeaf(List<String> directory) throws IOException;
}
