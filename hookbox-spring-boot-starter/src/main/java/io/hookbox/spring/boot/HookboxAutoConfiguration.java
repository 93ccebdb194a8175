package io.hookbox.spring.boot;

import io.hookbox.WebhookRelay;
import io.hookbox.bus.EventBus;
import io.hookbox.bus.InProcessEventBus;
import io.hookbox.dead.DeadLetterManager;
import io.hookbox.delivery.BackoffSchedule;
import io.hookbox.delivery.HttpClientTransport;
import io.hookbox.delivery.WebhookTransport;
import io.hookbox.dispatch.WebhookDispatcher;
import io.hookbox.jdbc.DataSourceConnectionProvider;
import io.hookbox.jdbc.store.AbstractJdbcDeliveryStore;
import io.hookbox.jdbc.store.JdbcDeadLetterStore;
import io.hookbox.jdbc.store.JdbcDeliveryStores;
import io.hookbox.jdbc.store.JdbcSubscriptionStore;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeadLetterStore;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.spi.MetricsExporter;
import io.hookbox.spi.SubscriptionStore;
import io.hookbox.subscription.SubscriptionManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;
import java.util.logging.Logger;

/**
 * Auto-configuration for webhook delivery.
 *
 * <p>Wires a {@link WebhookRelay} from a {@link DataSource} and
 * {@link HookboxProperties}, and subscribes its dispatcher to the {@link EventBus}.
 * Every bean backs off when the application defines its own.
 *
 * @see HookboxProperties
 * @see HookboxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WebhookRelay.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "hookbox", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(HookboxProperties.class)
public class HookboxAutoConfiguration {
    private static final Logger logger = Logger.getLogger(HookboxAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean(DeliveryStore.class)
    public AbstractJdbcDeliveryStore deliveryStore(DataSource dataSource) {
        return JdbcDeliveryStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(SubscriptionStore.class)
    public JdbcSubscriptionStore subscriptionStore() {
        return new JdbcSubscriptionStore();
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public JdbcDeadLetterStore deadLetterStore() {
        return new JdbcDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(EventBus.class)
    public InProcessEventBus eventBus() {
        return new InProcessEventBus();
    }

    @Bean
    @ConditionalOnMissingBean(WebhookTransport.class)
    public HttpClientTransport webhookTransport(HookboxProperties props) {
        return new HttpClientTransport(
                props.getHttp().getConnectTimeout(), props.getHttp().getRequestTimeout());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public WebhookRelay webhookRelay(HookboxProperties props,
                                     ConnectionProvider connectionProvider,
                                     SubscriptionStore subscriptionStore,
                                     DeliveryStore deliveryStore,
                                     DeadLetterStore deadLetterStore,
                                     WebhookTransport transport,
                                     EventBus eventBus,
                                     ObjectProvider<MetricsExporter> metricsProvider) {
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        var cl = props.getClaimLocking();
        WebhookRelay.AbstractBuilder<?> builder;
        if (cl.isEnabled()) {
            var multiNode = WebhookRelay.multiNode().lockTimeout(cl.getLockTimeout());
            if (cl.getOwnerId() != null && !cl.getOwnerId().isEmpty()) {
                multiNode.ownerId(cl.getOwnerId());
            }
            builder = multiNode;
        } else {
            builder = WebhookRelay.singleNode();
        }
        builder.connectionProvider(connectionProvider)
                .subscriptionStore(subscriptionStore)
                .deliveryStore(deliveryStore)
                .deadLetterStore(deadLetterStore)
                .transport(transport)
                .retryPolicy(new BackoffSchedule(props.getRetry().getSchedule()))
                .dedupWindow(props.getDedupWindow())
                .workerCount(props.getQueue().getWorkerCount())
                .queueCapacity(props.getQueue().getCapacity())
                .drainTimeoutMs(props.getQueue().getDrainTimeout().toMillis())
                .pollerEnabled(props.getPoller().isEnabled())
                .intervalMs(props.getPoller().getInterval().toMillis())
                .batchSize(props.getPoller().getBatchSize())
                .skipRecent(props.getPoller().getSkipRecent());
        if (metrics != null) {
            builder.metrics(metrics);
        }
        WebhookRelay relay = builder.build();
        List<String> registrations = relay.register(eventBus);
        logger.info("Webhook relay started (" + (cl.isEnabled() ? "multi-node" : "single-node")
                + "), " + registrations.size() + " event subscriptions registered");
        return relay;
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookDispatcher webhookDispatcher(WebhookRelay relay) {
        return relay.dispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionManager subscriptionManager(WebhookRelay relay) {
        return relay.subscriptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(WebhookRelay relay) {
        return relay.deadLetters();
    }
}
