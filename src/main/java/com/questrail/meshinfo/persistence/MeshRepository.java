package com.questrail.meshinfo.persistence;

/**
 * Transactional store of nodes, links and cycle statistics.
 */
public interface MeshRepository
{
    /**
     * Run {@code work} as one unit of work: everything it changes is committed
     * together if it returns normally, and nothing is committed if it throws.
     * Whatever {@code work} throws is rethrown unchanged.
     *
     * @throws RepositoryException if the unit of work cannot be started or committed
     */
    <T> T inTransaction(UnitOfWork<T> work);

    @FunctionalInterface
    interface UnitOfWork<T>
    {
        T run(RepositorySession session);
    }
}
