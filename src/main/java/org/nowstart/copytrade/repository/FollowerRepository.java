package org.nowstart.copytrade.repository;

import java.util.List;
import org.nowstart.copytrade.data.entity.Follower;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FollowerRepository extends JpaRepository<Follower, String> {

    List<Follower> findByActiveTrue();
}
