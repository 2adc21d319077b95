package com.mouse.betinfo.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Exposes only the insert and read half of the Spring Data CRUD surface.
 * No delete and no bulk save.
 */
@NoRepositoryBean
public interface AppendOnlyRepository<T, ID> extends Repository<T, ID> {

    <S extends T> S saveAndFlush(S entity);

    Optional<T> findById(ID id);

    boolean existsById(ID id);

    List<T> findAll();

    Page<T> findAll(Pageable pageable);

    long count();
}
