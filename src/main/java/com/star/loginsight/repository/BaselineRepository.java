package com.star.loginsight.repository;

import com.star.loginsight.entity.BaselineDocument;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BaselineRepository extends ElasticsearchRepository<BaselineDocument, String> {
    List<BaselineDocument> findByService(String service);
}
