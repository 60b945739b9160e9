package org.io;

import org.kripke.Model;
import org.kripke.World;
import org.lattice.FilteredLattice;
import org.lattice.Lattice;
import org.lattice.ManyLattice;

import java.util.List;

/**
 * Supplies fully validated core objects by name from some stored form (file, stream, etc.).
 *
 * Implementations should:
 * - build every object through the public constructors, so all invariants are checked
 * - resolve references by name (a world's lattice, a model's worlds, ...)
 * - fail with ReferentialIntegrityException for names they do not know
 */
public interface DefinitionSource {

    /** Names available for the given kind, in stored order. */
    List<String> names(DefinitionKind kind);

    Lattice lattice(String name);

    FilteredLattice filteredLattice(String name);

    ManyLattice manyLattice(String name);

    /** Worlds are stored under their long name. */
    World world(String longName);

    Model model(String name);
}
