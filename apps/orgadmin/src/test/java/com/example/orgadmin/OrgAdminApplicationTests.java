package com.example.orgadmin;

import com.example.orgadmin.authz.aspect.PermissionAuthorizationAspect;
import com.example.orgadmin.authz.audit.DecisionRecorder;
import com.example.orgadmin.authz.cache.DecisionCacheStore;
import com.example.orgadmin.authz.cache.InMemoryDecisionCacheStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class OrgAdminApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(DecisionCacheStore.class)).isInstanceOf(InMemoryDecisionCacheStore.class);
        assertThat(context.getBeansOfType(PermissionAuthorizationAspect.class)).hasSize(1);
        assertThat(context.getBeansOfType(DecisionRecorder.class)).hasSize(1);
    }
}
