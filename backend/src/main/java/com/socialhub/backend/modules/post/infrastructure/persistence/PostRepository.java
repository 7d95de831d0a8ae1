package com.socialhub.backend.modules.post.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.post.domain.Post;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostRepository extends JpaRepository<Post, UUID> {

    @Query("select p from Post p join fetch p.user order by p.createdAt desc")
    List<Post> findAllNewestFirst();

    @Query("select p from Post p join fetch p.user where p.id = :postId")
    Optional<Post> findWithUserById(@Param("postId") UUID postId);

    @Query("select p from Post p where p.id = :postId and p.user.id = :userId")
    Optional<Post> findOwnedBy(@Param("postId") UUID postId, @Param("userId") UUID userId);

    @Query("""
            select p
              from Post p
             where p.user.id = :userId
             order by p.pinned desc, p.createdAt desc
            """)
    List<Post> findProfilePosts(@Param("userId") UUID userId);
}
