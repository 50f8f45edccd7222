package com.authgate.backend.auth.repo;

import com.authgate.backend.auth.entity.App;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AppRepo extends JpaRepository<App, Integer> {
}
