package pointersnake.core;

public enum StepOutcome { MOVED, ATE_FOOD, COLLIDED }
