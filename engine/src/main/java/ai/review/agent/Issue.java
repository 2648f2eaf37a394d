package ai.review.agent;

/**
 * One review finding, structured after the Toulmin model of argumentation.
 *
 * @param claim what is wrong
 * @param grounds the evidence in the change
 * @param warrant why the evidence supports the claim
 * @param backing supporting references or practice
 * @param qualifier how certain the claim is
 */
public record Issue(String claim, String grounds, String warrant, String backing, String qualifier) {
}
