package zookeep.staffing.model;

public enum FoodType {
    MEAT,
    VEGETABLES,
    FRUIT,
    HAY
}
