package ai.review.mcts;

import ai.review.events.ReviewRequested;
import ai.review.events.SearchEvents.BackpropagationCompleted;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Subscribes the controller to both topics it reacts to.
 */
@Configuration
public class SearchWiring {

    @Bean
    public TopicSubscriber<ReviewRequested> reviewRequestedSubscriber(MctsController controller) {
        return TopicSubscriber.of(Topics.REVIEW_REQUESTED, ReviewRequested.class, controller::start);
    }

    @Bean
    public TopicSubscriber<BackpropagationCompleted> backpropagationCompletedSubscriber(MctsController controller) {
        return TopicSubscriber.of(Topics.BACKPROPAGATION_COMPLETED, BackpropagationCompleted.class,
                controller::onBackpropagationCompleted);
    }
}
