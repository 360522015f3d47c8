package my.temperaturescore.app.service;

/**
 * Internal invariant violation while reducing a single partition.
 */
public class ComputationException extends IllegalStateException {
	private final String partition;

	public ComputationException(String partition, String message) {
		super(message);
		this.partition = partition;
	}

	public String getPartition() {
		return partition;
	}
}
