package de.anton.spectral.unmixer.service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Directory layout of a spectral workspace: one library of end-member spectra and one
 * library of pre-processed mixed spectra, both holding canonical files.
 */
public record WorkspaceLayout(
    Path root,
    Path libraryDirectory, // end-members
    Path mixedDirectory    // pre-processed mixed spectra
) {
    /** System property that overrides the workspace root. */
    public static final String WORKSPACE_PROPERTY = "unmixer.workspace";
    public static final String DEFAULT_ROOT = "spectral";
    public static final String LIBRARY_DIRECTORY_NAME = "spectral_library";
    public static final String MIXED_DIRECTORY_NAME = "mixed_pre_processed";

    public WorkspaceLayout {
        Objects.requireNonNull(root, "Workspace root cannot be null.");
        Objects.requireNonNull(libraryDirectory, "Library directory cannot be null.");
        Objects.requireNonNull(mixedDirectory, "Mixed spectra directory cannot be null.");
    }

    /** Standard layout below the given root. */
    public static WorkspaceLayout under(Path root) {
        return new WorkspaceLayout(root, root.resolve(LIBRARY_DIRECTORY_NAME), root.resolve(MIXED_DIRECTORY_NAME));
    }

    /** Standard layout below {@value #WORKSPACE_PROPERTY}, or {@value #DEFAULT_ROOT} in the working directory. */
    public static WorkspaceLayout fromSystemProperties() {
        return under(Paths.get(System.getProperty(WORKSPACE_PROPERTY, DEFAULT_ROOT)));
    }
}
