package treelock.coordinator.model;

/**
 * The caller-owned work executed while the lock is held.
 */
@FunctionalInterface
public interface Operation {

    /**
     * @return true on success; false or an exception marks the operation failed
     */
    boolean execute() throws Exception;
}
