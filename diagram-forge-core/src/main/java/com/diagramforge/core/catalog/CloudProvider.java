package com.diagramforge.core.catalog;

import com.diagramforge.core.model.ComponentKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Service name to shape token tables for the three supported cloud providers.
 *
 * <p>Lookups never fail: an unrecognized service name is turned into a plausible token by
 * lower-casing and underscore-joining it under the provider's namespace, so callers must
 * tolerate approximate icons for unknown services.
 *
 * <pre>{@code
 * CloudProvider.AWS.shapeFor("Lambda");        // mxgraph.aws4.lambda
 * CloudProvider.AWS.shapeFor("AppRunner");     // mxgraph.aws4.app_runner (synthesized)
 * CloudProvider.GCP.serviceFor("mxgraph.gcp2.cloud_run"); // CloudRun
 * }</pre>
 */
public enum CloudProvider {

    AWS(ComponentKind.AWS_ICON, "mxgraph.aws4.", "EC2", awsServices()),
    AZURE(ComponentKind.AZURE_ICON, "mxgraph.azure.", "VirtualMachine", azureServices()),
    GCP(ComponentKind.GCP_ICON, "mxgraph.gcp2.", "ComputeEngine", gcpServices());

    private final ComponentKind kind;
    private final String prefix;
    private final String defaultService;
    private final Map<String, String> shapes;
    private final Map<String, String> servicesByShape;

    CloudProvider(ComponentKind kind, String prefix, String defaultService, Map<String, String> suffixes) {
        this.kind = kind;
        this.prefix = prefix;
        this.defaultService = defaultService;
        Map<String, String> shapeMap = new LinkedHashMap<>();
        Map<String, String> reverse = new LinkedHashMap<>();
        suffixes.forEach((service, suffix) -> {
            shapeMap.put(service, prefix + suffix);
            reverse.put(prefix + suffix, service);
        });
        this.shapes = Collections.unmodifiableMap(shapeMap);
        this.servicesByShape = Collections.unmodifiableMap(reverse);
    }

    public ComponentKind kind() {
        return kind;
    }

    /**
     * Returns the shape token namespace, including the trailing dot.
     *
     * @return prefix such as {@code mxgraph.aws4.}
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns the service assumed when a shape token carries no recognizable service.
     *
     * @return default service name
     */
    public String defaultService() {
        return defaultService;
    }

    /**
     * Returns the known services and their shape tokens in declaration order.
     *
     * @return unmodifiable service to shape map
     */
    public Map<String, String> knownServices() {
        return shapes;
    }

    /**
     * Resolves the shape token for a service, synthesizing one for unknown names.
     *
     * @param service service name, e.g. {@code S3}
     * @return shape token
     */
    public String shapeFor(String service) {
        if (service == null || service.isBlank()) {
            return shapes.get(defaultService);
        }
        String known = shapes.get(service);
        return known != null ? known : prefix + toSnakeCase(service);
    }

    /**
     * Recovers a service name from a shape token. Known tokens map back to their service;
     * other tokens in this namespace are PascalCased from their last segment.
     *
     * @param shape shape token from a style string
     * @return service name, or empty if the token is not in this provider's namespace
     */
    public Optional<String> serviceFor(String shape) {
        if (shape == null || !shape.startsWith(prefix)) {
            return Optional.empty();
        }
        String known = servicesByShape.get(shape);
        if (known != null) {
            return Optional.of(known);
        }
        String suffix = shape.substring(prefix.length());
        String lastSegment = suffix.substring(suffix.lastIndexOf('.') + 1);
        if (lastSegment.isBlank()) {
            return Optional.of(defaultService);
        }
        return Optional.of(toPascalCase(lastSegment));
    }

    /**
     * Returns the provider for a cloud icon kind.
     *
     * @param kind one of the cloud icon kinds
     * @return provider
     * @throws IllegalArgumentException if the kind is not a cloud icon
     */
    public static CloudProvider forKind(ComponentKind kind) {
        for (CloudProvider provider : values()) {
            if (provider.kind == kind) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Not a cloud icon kind: " + kind);
    }

    /**
     * Finds the provider whose namespace a shape token belongs to.
     *
     * @param shape shape token
     * @return provider, or empty
     */
    public static Optional<CloudProvider> forShape(String shape) {
        if (shape == null) {
            return Optional.empty();
        }
        for (CloudProvider provider : values()) {
            if (shape.startsWith(provider.prefix)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    static String toSnakeCase(String name) {
        String snake = name.trim()
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
            .replaceAll("[\\s\\-.]+", "_")
            .toLowerCase(Locale.ROOT);
        return snake.replaceAll("_+", "_");
    }

    static String toPascalCase(String snake) {
        StringBuilder out = new StringBuilder();
        for (String part : snake.split("_")) {
            if (!part.isEmpty()) {
                out.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return out.toString();
    }

    private static Map<String, String> awsServices() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("EC2", "ec2");
        m.put("S3", "s3");
        m.put("Lambda", "lambda");
        m.put("RDS", "rds");
        m.put("DynamoDB", "dynamodb");
        m.put("VPC", "vpc");
        m.put("CloudFront", "cloudfront");
        m.put("Route53", "route_53");
        m.put("APIGateway", "api_gateway");
        m.put("SNS", "sns");
        m.put("SQS", "sqs");
        m.put("ECS", "ecs");
        m.put("EKS", "eks");
        m.put("Fargate", "fargate");
        m.put("ElasticLoadBalancing", "elastic_load_balancing");
        m.put("CloudWatch", "cloudwatch");
        m.put("IAM", "iam");
        m.put("Cognito", "cognito");
        m.put("SecretsManager", "secrets_manager");
        m.put("KMS", "kms");
        m.put("Kinesis", "kinesis");
        m.put("Redshift", "redshift");
        m.put("ElastiCache", "elasticache");
        m.put("StepFunctions", "step_functions");
        m.put("EventBridge", "eventbridge");
        m.put("Athena", "athena");
        m.put("Glue", "glue");
        m.put("SageMaker", "sagemaker");
        m.put("Bedrock", "bedrock");
        return m;
    }

    private static Map<String, String> azureServices() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("VirtualMachine", "compute.virtual_machine");
        m.put("AppService", "compute.app_service");
        m.put("Functions", "compute.function_apps");
        m.put("SQLDatabase", "databases.sql_database");
        m.put("CosmosDB", "databases.cosmos_db");
        m.put("BlobStorage", "storage.blob_storage");
        m.put("VirtualNetwork", "networking.virtual_network");
        m.put("LoadBalancer", "networking.load_balancer");
        m.put("ApplicationGateway", "networking.application_gateway");
        m.put("AzureAD", "identity.azure_active_directory");
        m.put("KeyVault", "security.key_vault");
        m.put("Monitor", "management.monitor");
        m.put("AKS", "compute.kubernetes_services");
        m.put("ContainerInstances", "compute.container_instances");
        m.put("ServiceBus", "integration.service_bus");
        m.put("EventHub", "analytics.event_hubs");
        m.put("LogicApps", "integration.logic_apps");
        m.put("DataFactory", "analytics.data_factory");
        m.put("Synapse", "analytics.synapse_analytics");
        m.put("MachineLearning", "ai_machine_learning.machine_learning");
        m.put("OpenAI", "ai_machine_learning.azure_openai");
        return m;
    }

    private static Map<String, String> gcpServices() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("ComputeEngine", "compute_engine");
        m.put("CloudFunctions", "cloud_functions");
        m.put("CloudRun", "cloud_run");
        m.put("GKE", "google_kubernetes_engine");
        m.put("CloudSQL", "cloud_sql");
        m.put("Firestore", "firestore");
        m.put("BigQuery", "bigquery");
        m.put("CloudStorage", "cloud_storage");
        m.put("VPC", "virtual_private_cloud");
        m.put("CloudLoadBalancing", "cloud_load_balancing");
        m.put("CloudCDN", "cloud_cdn");
        m.put("CloudDNS", "cloud_dns");
        m.put("IAM", "cloud_iam");
        m.put("SecretManager", "secret_manager");
        m.put("PubSub", "cloud_pubsub");
        m.put("Dataflow", "dataflow");
        m.put("Composer", "cloud_composer");
        m.put("VertexAI", "vertex_ai");
        m.put("CloudMonitoring", "cloud_monitoring");
        return m;
    }
}
