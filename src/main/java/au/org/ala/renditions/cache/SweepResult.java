package au.org.ala.renditions.cache;

import com.google.common.base.MoreObjects;

public final class SweepResult {

    private final int filesDeleted;
    private final int directoriesRemoved;
    private final int filesRetained;
    private final int errors;

    SweepResult(int filesDeleted, int directoriesRemoved, int filesRetained, int errors) {
        this.filesDeleted = filesDeleted;
        this.directoriesRemoved = directoriesRemoved;
        this.filesRetained = filesRetained;
        this.errors = errors;
    }

    public int getFilesDeleted() {
        return filesDeleted;
    }

    public int getDirectoriesRemoved() {
        return directoriesRemoved;
    }

    public int getFilesRetained() {
        return filesRetained;
    }

    public int getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("filesDeleted", filesDeleted)
                .add("directoriesRemoved", directoriesRemoved)
                .add("filesRetained", filesRetained)
                .add("errors", errors)
                .toString();
    }
}
