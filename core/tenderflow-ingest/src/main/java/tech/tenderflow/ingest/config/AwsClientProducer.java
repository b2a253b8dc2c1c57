package tech.tenderflow.ingest.config;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.ssm.SsmClient;

import java.net.URI;

/**
 * CDI producer for the AWS clients used by the pipeline.
 *
 * All clients share region, credentials and endpoint override. Without a configured
 * region the SDK's default region chain applies (AWS_REGION inside Lambda).
 */
@ApplicationScoped
public class AwsClientProducer {

    private static final Logger LOG = Logger.getLogger(AwsClientProducer.class);

    private final TenderPipelineConfig.Aws awsConfig;

    @Inject
    public AwsClientProducer(TenderPipelineConfig config) {
        this.awsConfig = config.aws();
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public SqsClient createSqsClient() {
        LOG.info("Creating SQS client");
        return configure(SqsClient.builder()).build();
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public BedrockRuntimeClient createBedrockRuntimeClient() {
        LOG.info("Creating Bedrock runtime client");
        return configure(BedrockRuntimeClient.builder()).build();
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public SsmClient createSsmClient() {
        LOG.info("Creating SSM client");
        return configure(SsmClient.builder()).build();
    }

    private <B extends AwsClientBuilder<B, ?>> B configure(B builder) {
        builder.credentialsProvider(DefaultCredentialsProvider.create());

        awsConfig.region().ifPresent(region -> builder.region(Region.of(region)));

        // Use endpoint override if configured (for LocalStack testing)
        awsConfig.endpointOverride().ifPresent(endpoint -> {
            LOG.infof("Using AWS endpoint override: %s", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        });

        return builder;
    }
}
