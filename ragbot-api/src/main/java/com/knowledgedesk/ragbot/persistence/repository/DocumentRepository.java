package com.knowledgedesk.ragbot.persistence.repository;

import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findByStatusOrderByUpdatedAtDesc(DocumentStatus status);

    List<DocumentEntity> findTop50ByOrderByUpdatedAtDesc();
}
