package com.eyelevel.pagepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "document_page", uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_page", columnNames = {"document_id", "page_number"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    @Column(name = "page_number", nullable = false)
    private Integer pageNumber;

    private String image;

    private String thumbnail;

    @Builder.Default
    @Column(nullable = false)
    private Integer width = 0;

    @Builder.Default
    @Column(nullable = false)
    private Integer height = 0;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
